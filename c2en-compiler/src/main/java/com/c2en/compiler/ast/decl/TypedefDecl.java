package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.type.TypeRef;

/**
 * 类型别名 typedef。
 * 形如 {@code typedef struct { ... } Point;} 时，definition 持有内联的结构体/枚举定义。
 */
public class TypedefDecl extends AstNode {
    private final TypeRef target;
    private final String alias;
    private final AstNode definition;

    public TypedefDecl(SourceLocation location, TypeRef target, String alias, AstNode definition) {
        super(location);
        this.target = target;
        this.alias = alias;
        this.definition = definition;
    }

    public TypeRef getTarget() {
        return target;
    }

    public String getAlias() {
        return alias;
    }

    public AstNode getDefinition() {
        return definition;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypedefDecl(this, context);
    }
}
