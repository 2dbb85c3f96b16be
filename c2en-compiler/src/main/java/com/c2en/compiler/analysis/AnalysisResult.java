package com.c2en.compiler.analysis;

import java.util.Collections;
import java.util.List;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final SymbolTable symbolTable;
    private final List<SemanticDiagnostic> diagnostics;

    public AnalysisResult(SymbolTable symbolTable, List<SemanticDiagnostic> diagnostics) {
        this.symbolTable = symbolTable;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public SymbolTable getSymbolTable() { return symbolTable; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
