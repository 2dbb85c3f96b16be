package com.c2en.compiler.ast.type;

import com.c2en.compiler.lexer.TokenType;

/**
 * 基本类型说明符，解析时由关键词一次性确定
 */
public enum TypeKeyword {
    VOID("void"),
    CHAR("char"),
    SHORT("short"),
    INT("int"),
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double"),
    SIGNED("signed"),
    UNSIGNED("unsigned");

    private final String spelling;

    TypeKeyword(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }

    /**
     * 关键词记号到类型说明符，非类型关键词返回 null
     */
    public static TypeKeyword fromToken(TokenType type) {
        switch (type) {
            case KW_VOID:     return VOID;
            case KW_CHAR:     return CHAR;
            case KW_SHORT:    return SHORT;
            case KW_INT:      return INT;
            case KW_LONG:     return LONG;
            case KW_FLOAT:    return FLOAT;
            case KW_DOUBLE:   return DOUBLE;
            case KW_SIGNED:   return SIGNED;
            case KW_UNSIGNED: return UNSIGNED;
            default:          return null;
        }
    }
}
