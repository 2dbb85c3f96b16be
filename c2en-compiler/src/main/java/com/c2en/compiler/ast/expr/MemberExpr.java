package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 成员访问 {@code obj.member} 或经指针访问 {@code ptr->member}
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;
    private final boolean arrow;

    public MemberExpr(SourceLocation location, Expression target, String member, boolean arrow) {
        super(location);
        this.target = target;
        this.member = member;
        this.arrow = arrow;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public boolean isArrow() {
        return arrow;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
