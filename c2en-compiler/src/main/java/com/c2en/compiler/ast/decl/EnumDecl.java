package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 枚举定义
 */
public class EnumDecl extends AstNode {
    private final String name;  // 匿名枚举为 null
    private final List<EnumConstant> constants;

    public EnumDecl(SourceLocation location, String name, List<EnumConstant> constants) {
        super(location);
        this.name = name;
        this.constants = Collections.unmodifiableList(new ArrayList<>(constants));
    }

    public String getName() {
        return name;
    }

    public List<EnumConstant> getConstants() {
        return constants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /**
     * 枚举常量，value 可选
     */
    public static final class EnumConstant {
        private final SourceLocation location;
        private final String name;
        private final Expression value;

        public EnumConstant(SourceLocation location, String name, Expression value) {
            this.location = location;
            this.name = name;
            this.value = value;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
