package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用。C 子集只允许按名字调用。
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
