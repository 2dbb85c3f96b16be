package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 花括号初始化列表 {@code {1, 2, 3}}
 */
public class InitializerList extends Expression {
    private final List<Expression> elements;

    public InitializerList(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInitializerList(this, context);
    }
}
