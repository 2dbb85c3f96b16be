package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.expr.Expression;

import java.util.List;

/**
 * case 或 default 分支（value 为 null 表示 default）
 */
public class CaseClause extends AstNode {
    private final Expression value;
    private final List<Statement> body;

    public CaseClause(SourceLocation location, Expression value, List<Statement> body) {
        super(location);
        this.value = value;
        this.body = body;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isDefault() {
        return value == null;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseClause(this, context);
    }
}
