package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.type.TypeRef;

/**
 * 函数参数。原型中的参数可以没有名字（name 为 null）。
 */
public final class Parameter {
    private final SourceLocation location;
    private final TypeRef type;
    private final String name;
    private final boolean array;

    public Parameter(SourceLocation location, TypeRef type, String name, boolean array) {
        this.location = location;
        this.type = type;
        this.name = name;
        this.array = array;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public boolean isArray() {
        return array;
    }
}
