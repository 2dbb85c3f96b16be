package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;
    private final boolean transparent;

    public Block(SourceLocation location, List<Statement> statements) {
        this(location, statements, false);
    }

    public Block(SourceLocation location, List<Statement> statements, boolean transparent) {
        super(location);
        this.statements = statements;
        this.transparent = transparent;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    /** transparent block 只是多个声明符的分组（如 for 初始化中的 int i = 0, j = 9），源码中没有花括号 */
    public boolean isTransparent() {
        return transparent;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
