package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 字面量表达式。text 保留源码词素（字符串和字符字面量带引号）。
 */
public class Literal extends Expression {
    private final String text;
    private final LiteralKind kind;

    public Literal(SourceLocation location, String text, LiteralKind kind) {
        super(location);
        this.text = text;
        this.kind = kind;
    }

    public String getText() {
        return text;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        CHAR
    }
}
