package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.type.TypeRef;

/**
 * 类型转换 {@code (type) expr}
 */
public class CastExpr extends Expression {
    private final TypeRef targetType;
    private final Expression operand;

    public CastExpr(SourceLocation location, TypeRef targetType, Expression operand) {
        super(location);
        this.targetType = targetType;
        this.operand = operand;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
