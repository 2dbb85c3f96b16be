package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Switch 语句。case 默认贯穿，结构上由各 CaseClause 依次排列表示。
 */
public class SwitchStmt extends Statement {
    private final Expression subject;
    private final List<CaseClause> clauses;

    public SwitchStmt(SourceLocation location, Expression subject, List<CaseClause> clauses) {
        super(location);
        this.subject = subject;
        this.clauses = clauses;
    }

    public Expression getSubject() {
        return subject;
    }

    public List<CaseClause> getClauses() {
        return clauses;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }
}
