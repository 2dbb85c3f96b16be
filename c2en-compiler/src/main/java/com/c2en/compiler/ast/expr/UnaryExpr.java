package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 一元表达式（前缀与后缀）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isPrefix() {
        return operator.isPrefix();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-", true),
        POS("+", true),
        NOT("!", true),
        BIT_NOT("~", true),
        ADDRESS_OF("&", true),
        DEREF("*", true),
        PRE_INC("++", true),
        PRE_DEC("--", true),
        POST_INC("++", false),
        POST_DEC("--", false);

        private final String source;
        private final boolean prefix;

        UnaryOp(String source, boolean prefix) {
            this.source = source;
            this.prefix = prefix;
        }

        /** 返回 C 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isPrefix() {
            return prefix;
        }
    }
}
