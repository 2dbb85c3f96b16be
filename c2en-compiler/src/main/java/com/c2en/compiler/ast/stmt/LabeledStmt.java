package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 带标签的语句 {@code label: stmt}
 */
public class LabeledStmt extends Statement {
    private final String label;
    private final Statement statement;

    public LabeledStmt(SourceLocation location, String label, Statement statement) {
        super(location);
        this.label = label;
        this.statement = statement;
    }

    public String getLabel() {
        return label;
    }

    public Statement getStatement() {
        return statement;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLabeledStmt(this, context);
    }
}
