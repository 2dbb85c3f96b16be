package com.c2en.compiler.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域帧。帧之间不互相引用，由 {@link SymbolTable} 的栈维护嵌套关系。
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        FUNCTION    // 函数体（参数与局部变量共享一个扁平作用域）
    }

    private final ScopeType type;
    private final String name;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    public Scope(ScopeType type, String name) {
        this.type = type;
        this.name = name;
    }

    public ScopeType getType() { return type; }
    public String getName() { return name; }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    /** 注册符号到当前作用域（同名时后者覆盖前者） */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }
}
