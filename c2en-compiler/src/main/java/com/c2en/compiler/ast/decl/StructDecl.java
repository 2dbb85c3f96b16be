package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体或联合体定义
 */
public class StructDecl extends AstNode {
    private final boolean union;
    private final String name;
    private final List<Field> fields;

    public StructDecl(SourceLocation location, boolean union, String name, List<Field> fields) {
        super(location);
        this.union = union;
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public boolean isUnion() {
        return union;
    }

    public String getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }

    /**
     * 成员
     */
    public static final class Field {
        private final TypeRef type;
        private final String name;
        private final String arraySize;

        public Field(TypeRef type, String name, String arraySize) {
            this.type = type;
            this.name = name;
            this.arraySize = arraySize;
        }

        public TypeRef getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        /** 数组成员的长度文本，非数组为 null */
        public String getArraySize() {
            return arraySize;
        }

        public boolean isArray() {
            return arraySize != null;
        }
    }
}
