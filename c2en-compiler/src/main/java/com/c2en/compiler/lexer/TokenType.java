package com.c2en.compiler.lexer;

/**
 * C 子集词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING_LITERAL,
    CHAR_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 类型 ===
    KW_INT, KW_CHAR, KW_FLOAT, KW_DOUBLE, KW_VOID,
    KW_SIGNED, KW_UNSIGNED, KW_LONG, KW_SHORT,
    KW_STRUCT, KW_UNION, KW_ENUM, KW_TYPEDEF,

    // === 关键词 - 修饰符 ===
    KW_CONST, KW_STATIC, KW_EXTERN,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_DO,
    KW_RETURN, KW_BREAK, KW_CONTINUE,
    KW_SWITCH, KW_CASE, KW_DEFAULT, KW_GOTO,

    // === 关键词 - 其他 ===
    KW_SIZEOF,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    INC,            // ++
    DEC,            // --

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 操作符 - 位运算 ===
    AMPERSAND,      // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    SHL,            // <<
    SHR,            // >>

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    MOD_ASSIGN,     // %=
    AND_ASSIGN,     // &=
    OR_ASSIGN,      // |=
    XOR_ASSIGN,     // ^=
    SHL_ASSIGN,     // <<=
    SHR_ASSIGN,     // >>=

    // === 操作符 - 其他 ===
    ARROW,          // ->
    DOT,            // .
    ELLIPSIS,       // ...
    QUESTION,       // ?
    COLON,          // :

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否可以开始一个类型（不含 typedef 别名，别名由解析器识别）
     */
    public boolean isTypeStart() {
        switch (this) {
            case KW_INT:
            case KW_CHAR:
            case KW_FLOAT:
            case KW_DOUBLE:
            case KW_VOID:
            case KW_SIGNED:
            case KW_UNSIGNED:
            case KW_LONG:
            case KW_SHORT:
            case KW_STRUCT:
            case KW_UNION:
            case KW_ENUM:
            case KW_CONST:
            case KW_STATIC:
            case KW_EXTERN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为赋值操作符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
            case MOD_ASSIGN:
            case AND_ASSIGN:
            case OR_ASSIGN:
            case XOR_ASSIGN:
            case SHL_ASSIGN:
            case SHR_ASSIGN:
                return true;
            default:
                return false;
        }
    }
}
