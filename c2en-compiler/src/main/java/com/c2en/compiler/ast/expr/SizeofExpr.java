package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.type.TypeRef;

/**
 * sizeof 表达式，操作数是类型或表达式（二者恰有其一）
 */
public class SizeofExpr extends Expression {
    private final TypeRef targetType;
    private final Expression operand;

    public SizeofExpr(SourceLocation location, TypeRef targetType, Expression operand) {
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

    public boolean isTypeOperand() {
        return targetType != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSizeofExpr(this, context);
    }
}
