package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;

/**
 * Do-While 语句
 */
public class DoWhileStmt extends Statement {
    private final Statement body;
    private final Expression condition;

    public DoWhileStmt(SourceLocation location, Statement body, Expression condition) {
        super(location);
        this.body = body;
        this.condition = condition;
    }

    public Statement getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDoWhileStmt(this, context);
    }
}
