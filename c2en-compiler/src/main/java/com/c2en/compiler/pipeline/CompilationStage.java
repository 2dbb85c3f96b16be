package com.c2en.compiler.pipeline;

/**
 * 编译阶段，按执行顺序排列
 */
public enum CompilationStage {
    LEX("tokenize", "Lexical analysis failed"),
    PARSE("parse", "Syntax analysis failed"),
    CHECK("check", "Semantic analysis failed"),
    RENDER("render", "Translation failed");

    private final String displayName;
    private final String failureMessage;

    CompilationStage(String displayName, String failureMessage) {
        this.displayName = displayName;
        this.failureMessage = failureMessage;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 该阶段失败时给用户的提示 */
    public String getFailureMessage() {
        return failureMessage;
    }
}
