package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.lexer.TokenType;

/**
 * 赋值与复合赋值表达式（右结合）
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isCompound() {
        return operator != AssignOp.ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("="),
        ADD_ASSIGN("+="),
        SUB_ASSIGN("-="),
        MUL_ASSIGN("*="),
        DIV_ASSIGN("/="),
        MOD_ASSIGN("%="),
        AND_ASSIGN("&="),
        OR_ASSIGN("|="),
        XOR_ASSIGN("^="),
        SHL_ASSIGN("<<="),
        SHR_ASSIGN(">>=");

        private final String source;

        AssignOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static AssignOp fromToken(TokenType type) {
            switch (type) {
                case ASSIGN:       return ASSIGN;
                case PLUS_ASSIGN:  return ADD_ASSIGN;
                case MINUS_ASSIGN: return SUB_ASSIGN;
                case MUL_ASSIGN:   return MUL_ASSIGN;
                case DIV_ASSIGN:   return DIV_ASSIGN;
                case MOD_ASSIGN:   return MOD_ASSIGN;
                case AND_ASSIGN:   return AND_ASSIGN;
                case OR_ASSIGN:    return OR_ASSIGN;
                case XOR_ASSIGN:   return XOR_ASSIGN;
                case SHL_ASSIGN:   return SHL_ASSIGN;
                case SHR_ASSIGN:   return SHR_ASSIGN;
                default:
                    throw new IllegalArgumentException("Not an assignment operator: " + type);
            }
        }
    }
}
