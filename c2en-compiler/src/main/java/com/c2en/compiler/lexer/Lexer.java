package com.c2en.compiler.lexer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * C 子集词法分析器
 *
 * <p>单遍从左到右扫描。空白、预处理指令行与注释被整体跳过；
 * 第一个词法错误会生成 ERROR 记号并立即结束扫描，不做恢复。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean hadError = false;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 类型
        map.put("int", TokenType.KW_INT);
        map.put("char", TokenType.KW_CHAR);
        map.put("float", TokenType.KW_FLOAT);
        map.put("double", TokenType.KW_DOUBLE);
        map.put("void", TokenType.KW_VOID);
        map.put("signed", TokenType.KW_SIGNED);
        map.put("unsigned", TokenType.KW_UNSIGNED);
        map.put("long", TokenType.KW_LONG);
        map.put("short", TokenType.KW_SHORT);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("union", TokenType.KW_UNION);
        map.put("enum", TokenType.KW_ENUM);
        map.put("typedef", TokenType.KW_TYPEDEF);

        // 修饰符
        map.put("const", TokenType.KW_CONST);
        map.put("static", TokenType.KW_STATIC);
        map.put("extern", TokenType.KW_EXTERN);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("do", TokenType.KW_DO);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("switch", TokenType.KW_SWITCH);
        map.put("case", TokenType.KW_CASE);
        map.put("default", TokenType.KW_DEFAULT);
        map.put("goto", TokenType.KW_GOTO);

        map.put("sizeof", TokenType.KW_SIZEOF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回 Token 列表。
     * 列表总以一个 EOF 记号结尾；出错时以一个 ERROR 记号结尾。
     */
    public List<Token> scanTokens() {
        while (!hadError) {
            skipTrivia();
            if (hadError) {
                break;
            }
            if (isAtEnd()) {
                markStart();
                tokens.add(new Token(TokenType.EOF, "", line, column));
                break;
            }
            markStart();
            scanToken();
        }
        LOG.fine(() -> "Scanned " + tokens.size() + " tokens from " + fileName);
        return tokens;
    }

    /**
     * 是否遇到了词法错误
     */
    public boolean hasError() {
        return hadError;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    /**
     * 跳过空白、预处理指令和注释
     */
    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f' || c == '\u000B') {
                advance();
            } else if (c == '#') {
                directive();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                markStart();
                advance();
                advance();
                blockComment();
                if (hadError) {
                    return;
                }
            } else {
                return;
            }
        }
    }

    private void directive() {
        while (!isAtEnd() && peek() != '\n') {
            // 反斜杠续行
            if (peek() == '\\' && peekNext() == '\n') {
                advance();
            }
            advance();
        }
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error("Unterminated block comment");
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case ':': addToken(TokenType.COLON); break;
            case '~': addToken(TokenType.TILDE); break;

            // 可能是多字符的 Token
            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;
            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('>')) addToken(TokenType.ARROW);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else addToken(TokenType.MINUS);
                break;
            case '*':
                addToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.STAR);
                break;
            case '/':
                addToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.SLASH);
                break;
            case '%':
                addToken(match('=') ? TokenType.MOD_ASSIGN : TokenType.PERCENT);
                break;
            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;
            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;
            case '<':
                if (match('<')) addToken(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                else if (match('=')) addToken(TokenType.LE);
                else addToken(TokenType.LT);
                break;
            case '>':
                if (match('>')) addToken(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                else if (match('=')) addToken(TokenType.GE);
                else addToken(TokenType.GT);
                break;
            case '&':
                if (match('&')) addToken(TokenType.AND);
                else if (match('=')) addToken(TokenType.AND_ASSIGN);
                else addToken(TokenType.AMPERSAND);
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR);
                else if (match('=')) addToken(TokenType.OR_ASSIGN);
                else addToken(TokenType.PIPE);
                break;
            case '^':
                addToken(match('=') ? TokenType.XOR_ASSIGN : TokenType.CARET);
                break;
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '"':
                quoted('"', TokenType.STRING_LITERAL, "Unterminated string");
                break;
            case '\'':
                quoted('\'', TokenType.CHAR_LITERAL, "Unterminated character literal");
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: '" + c + "'");
                }
                break;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), startLine, startColumn));
    }

    // === 复杂 Token 扫描 ===

    /**
     * 字符串与字符字面量：反斜杠跳过下一个字符，不解释转义；词素保留引号。
     */
    private void quoted(char quote, TokenType type, String unterminatedMessage) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                break;
            }
            if (peek() == '\\' && current + 1 < source.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd() || peek() != quote) {
            error(unterminatedMessage);
            return;
        }
        advance();
        addToken(type);
    }

    /**
     * 数字：整数或一个小数点后接数字，不支持指数、进制前缀与后缀
     */
    private void number() {
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        addToken(type != null ? type : TokenType.IDENTIFIER);
    }

    // === 错误处理 ===

    private void error(String message) {
        hadError = true;
        String errorMsg = String.format("[ERROR] %s:%d:%d: Lexical error: %s",
                fileName, startLine, startColumn, message);
        errStream.println(errorMsg);
        tokens.add(new Token(TokenType.ERROR, message, startLine, startColumn));
    }
}
