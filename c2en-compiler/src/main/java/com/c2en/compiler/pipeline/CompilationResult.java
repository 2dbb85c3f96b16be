package com.c2en.compiler.pipeline;

import com.c2en.compiler.analysis.SemanticDiagnostic;
import com.c2en.compiler.ast.decl.Program;
import com.c2en.compiler.lexer.Token;
import com.c2en.compiler.parser.ParseError;

import java.util.Collections;
import java.util.List;

/**
 * 一次编译的结果。失败时 {@link #getFailedStage()} 指出第一个失败的阶段，
 * 之后的阶段不会执行，对应字段为空。
 */
public final class CompilationResult {
    private final CompilationStage failedStage;
    private final List<Token> tokens;
    private final Program program;
    private final List<ParseError> parseErrors;
    private final List<SemanticDiagnostic> diagnostics;
    private final String output;

    CompilationResult(CompilationStage failedStage, List<Token> tokens, Program program,
                      List<ParseError> parseErrors, List<SemanticDiagnostic> diagnostics, String output) {
        this.failedStage = failedStage;
        this.tokens = tokens != null ? tokens : Collections.<Token>emptyList();
        this.program = program;
        this.parseErrors = parseErrors != null ? parseErrors : Collections.<ParseError>emptyList();
        this.diagnostics = diagnostics != null ? diagnostics : Collections.<SemanticDiagnostic>emptyList();
        this.output = output;
    }

    public boolean isSuccess() {
        return failedStage == null;
    }

    /** 第一个失败的阶段，成功时为 null */
    public CompilationStage getFailedStage() {
        return failedStage;
    }

    public List<Token> getTokens() { return tokens; }
    public Program getProgram() { return program; }
    public List<ParseError> getParseErrors() { return parseErrors; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    /** 翻译结果，失败时为 null */
    public String getOutput() {
        return output;
    }
}
