package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.stmt.Block;
import com.c2en.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明。body 为 null 时表示原型。
 */
public class FunctionDecl extends AstNode {
    private final TypeRef returnType;
    private final String name;
    private final List<Parameter> params;
    private final boolean variadic;
    private final boolean isStatic;
    private final Block body;

    public FunctionDecl(SourceLocation location, TypeRef returnType, String name,
                        List<Parameter> params, boolean variadic, boolean isStatic, Block body) {
        super(location);
        this.returnType = returnType;
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.variadic = variadic;
        this.isStatic = isStatic;
        this.body = body;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public Block getBody() {
        return body;
    }

    public boolean isDefinition() {
        return body != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
