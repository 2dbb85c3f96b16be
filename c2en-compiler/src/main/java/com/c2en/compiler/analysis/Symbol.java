package com.c2en.compiler.analysis;

import com.c2en.compiler.ast.SourceLocation;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final String typeName;        // 类型名 ("int", "char*" 等)
    private final String scopeName;       // 所属作用域名（全局为 "global"，函数为函数名）
    private final SourceLocation location;// 声明位置
    private final boolean array;
    private boolean defined;              // 函数：是否已有函数体

    public Symbol(String name, SymbolKind kind, String typeName, String scopeName,
                  SourceLocation location, boolean array) {
        this.name = name;
        this.kind = kind;
        this.typeName = typeName;
        this.scopeName = scopeName;
        this.location = location;
        this.array = array;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public String getTypeName() { return typeName; }
    public String getScopeName() { return scopeName; }
    public SourceLocation getLocation() { return location; }
    public boolean isArray() { return array; }
    public boolean isFunction() { return kind == SymbolKind.FUNCTION; }

    /** 指针类型的变量也允许下标访问 */
    public boolean isIndexable() {
        return array || (typeName != null && typeName.endsWith("*"));
    }

    public int getDeclarationLine() {
        return location != null ? location.getLine() : 0;
    }

    public boolean isDefined() { return defined; }
    public void setDefined(boolean defined) { this.defined = defined; }

    @Override
    public String toString() {
        return kind + " " + name + ": " + typeName + (array ? "[]" : "");
    }
}
