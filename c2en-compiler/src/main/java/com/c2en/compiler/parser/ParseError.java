package com.c2en.compiler.parser;

import com.c2en.compiler.lexer.Token;

/**
 * 解析过程中收集的语法错误
 */
public final class ParseError {
    private final String message;
    private final Token token;

    public ParseError(String message, Token token) {
        this.message = message;
        this.token = token;
    }

    public String getMessage() {
        return message;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    /**
     * 诊断输出格式 {@code [ERROR] file:line:column: message}
     */
    public String format(String fileName) {
        return String.format("[ERROR] %s:%d:%d: %s", fileName, getLine(), getColumn(), message);
    }

    @Override
    public String toString() {
        return getLine() + ":" + getColumn() + ": " + message;
    }
}
