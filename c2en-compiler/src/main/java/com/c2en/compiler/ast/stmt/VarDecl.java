package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;
import com.c2en.compiler.ast.type.TypeRef;

/**
 * 变量声明（标量或数组，可带初始化器）。也用于全局变量。
 */
public class VarDecl extends Statement {
    private final TypeRef type;
    private final String name;
    private final boolean array;
    private final Expression arraySize;    // 可选：int a[] = {...}
    private final Expression initializer;  // 可选
    private final boolean isStatic;

    public VarDecl(SourceLocation location, TypeRef type, String name, boolean array,
                   Expression arraySize, Expression initializer, boolean isStatic) {
        super(location);
        this.type = type;
        this.name = name;
        this.array = array;
        this.arraySize = arraySize;
        this.initializer = initializer;
        this.isStatic = isStatic;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public boolean isArray() {
        return array;
    }

    public Expression getArraySize() {
        return arraySize;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
