package com.c2en.compiler.parser;

import com.c2en.compiler.lexer.Token;

/**
 * 解析异常。只在解析器内部抛出，由块级或顶层的错误恢复捕获并转为 {@link ParseError}。
 */
public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
