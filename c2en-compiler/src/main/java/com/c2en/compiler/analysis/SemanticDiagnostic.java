package com.c2en.compiler.analysis;

import com.c2en.compiler.ast.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Kind {
        DUPLICATE_DECLARATION,
        DUPLICATE_FUNCTION,
        UNDECLARED_IDENTIFIER,
        UNDEFINED_FUNCTION,
        UNDECLARED_ARRAY,
        NOT_AN_ARRAY
    }

    private final Kind kind;
    private final String name;
    private final String message;
    private final SourceLocation location;

    public SemanticDiagnostic(Kind kind, String name, String message, SourceLocation location) {
        this.kind = kind;
        this.name = name;
        this.message = message;
        this.location = location;
    }

    public Kind getKind() { return kind; }
    /** 诊断涉及的标识符 */
    public String getName() { return name; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    /**
     * 诊断输出格式 {@code [SEMANTIC ERROR] file:line: message}
     */
    public String format() {
        return String.format("[SEMANTIC ERROR] %s:%d: %s",
                location.getFile(), location.getLine(), message);
    }

    @Override
    public String toString() {
        return format();
    }
}
