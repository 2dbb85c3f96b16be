package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;

/**
 * C 风格三段式 For 语句，三个子句均可省略
 */
public class ForStmt extends Statement {
    private final Statement init;        // VarDecl、透明 Block 或 ExpressionStmt
    private final Expression condition;
    private final Expression update;
    private final Statement body;

    public ForStmt(SourceLocation location, Statement init, Expression condition,
                   Expression update, Statement body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Statement getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
