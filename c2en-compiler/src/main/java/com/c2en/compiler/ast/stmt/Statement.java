package com.c2en.compiler.ast.stmt;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
