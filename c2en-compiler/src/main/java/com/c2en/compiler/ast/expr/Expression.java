package com.c2en.compiler.ast.expr;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
