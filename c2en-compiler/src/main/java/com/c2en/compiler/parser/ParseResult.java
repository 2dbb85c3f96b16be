package com.c2en.compiler.parser;

import com.c2en.compiler.ast.decl.Program;

import java.util.Collections;
import java.util.List;

/**
 * 解析结果。只要记录过错误，就不交出语法树（program 为 null）。
 */
public final class ParseResult {
    private final Program program;
    private final List<ParseError> errors;

    public ParseResult(Program program, List<ParseError> errors) {
        this.program = errors.isEmpty() ? program : null;
        this.errors = Collections.unmodifiableList(errors);
    }

    public Program getProgram() {
        return program;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isSuccess() {
        return program != null;
    }
}
