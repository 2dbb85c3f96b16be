package com.c2en.compiler.parser;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.decl.Program;
import com.c2en.compiler.ast.expr.Expression;
import com.c2en.compiler.ast.stmt.Block;
import com.c2en.compiler.ast.stmt.Statement;
import com.c2en.compiler.ast.type.TypeRef;
import com.c2en.compiler.lexer.Token;
import com.c2en.compiler.lexer.TokenType;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import static com.c2en.compiler.lexer.TokenType.*;

/**
 * C 子集递归下降解析器
 *
 * <p>在随机访问的记号列表上移动 {@code current} 游标，向前看一个记号。
 * 语法错误以 {@link ParseException} 抛出，由块级和顶层的恢复逻辑捕获、
 * 记录为 {@link ParseError} 并同步到下一个语句或声明边界后继续解析。</p>
 */
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private final List<Token> tokens;
    final String fileName;
    private final PrintStream errStream;
    private final List<ParseError> errors = new ArrayList<>();

    /** typedef 引入的类型名，用于区分声明与表达式 */
    private final Set<String> typedefNames = new HashSet<>();

    private int position = 0;
    Token current;
    Token previous;

    /** 表达式与语句的最大嵌套层数，超过后报告语法错误，不再继续递归 */
    static final int MAX_NESTING = 256;
    private int nesting = 0;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        this(tokens, fileName, System.err);
    }

    public Parser(List<Token> tokens, String fileName, PrintStream errStream) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isOneOf(EOF, ERROR)) {
            throw new IllegalArgumentException("Token list must end with EOF or ERROR");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.errStream = errStream;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token。停在最后一个记号上不再前进。
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
            current = tokens.get(position);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    /**
     * 标记当前位置，用于回溯
     */
    int mark() {
        return position;
    }

    /**
     * 回溯到标记的位置
     */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    boolean isAtEnd() {
        return current.isOneOf(EOF, ERROR);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current);
    }

    /**
     * 从当前 token 创建位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return previous != null ? locationOf(previous) : location();
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    // ============ 类型名判定 ============

    void registerTypedefName(String name) {
        typedefNames.add(name);
    }

    boolean isTypedefName(Token token) {
        return token.is(IDENTIFIER) && typedefNames.contains(token.getLexeme());
    }

    /**
     * 当前 token 能否开始一个类型（关键词或已知 typedef 名）
     */
    boolean isTypeStart() {
        return current.getType().isTypeStart() || isTypedefName(current);
    }

    /**
     * 下一个 token 能否开始一个类型，用于识别 {@code (type)} 转换和 sizeof(type)
     */
    boolean isTypeStartAhead() {
        Token next = peek();
        return next.getType().isTypeStart() || isTypedefName(next);
    }

    // ============ 嵌套深度 ============

    /**
     * 进入一层递归下降，必须与 {@link #exitNesting()} 成对出现在 try/finally 中
     */
    void enterNesting(String message) {
        if (nesting >= MAX_NESTING) {
            throw new ParseException(message, current);
        }
        nesting++;
    }

    void exitNesting() {
        nesting--;
    }

    // ============ 错误处理 ============

    void recordError(ParseException e) {
        ParseError error = new ParseError(e.getMessage(), e.getToken());
        errors.add(error);
        errStream.println(error.format(fileName));
    }

    // ============ 程序解析 ============

    /**
     * 解析整个翻译单元。
     *
     * <p>某个外部声明解析失败时，记录错误并跳到下一个可能的声明起点（类型关键词）继续。
     * 只要出现过错误，结果里就没有语法树。</p>
     */
    public ParseResult parse() {
        SourceLocation loc = location();
        List<AstNode> declarations = new ArrayList<>();

        if (check(ERROR)) {
            recordError(new ParseException("Lexical error: " + current.getLexeme(), current));
        }
        while (!isAtEnd()) {
            try {
                declarations.addAll(declParser.parseExternalDeclaration());
            } catch (ParseException e) {
                recordError(e);
                synchronize();
            }
        }

        LOG.fine(() -> "Parsed " + declarations.size() + " external declarations with "
                + errors.size() + " errors");
        return new ParseResult(new Program(loc, declarations), errors);
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    /**
     * 顶层错误恢复：跳过触发错误的 token，再跳到花括号外层的下一个类型起始记号。
     */
    private void synchronize() {
        advance();
        int depth = 0;
        while (!isAtEnd()) {
            if (check(LBRACE)) {
                depth++;
            } else if (check(RBRACE)) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && (isTypeStart() || check(KW_TYPEDEF))) {
                return;
            }
            advance();
        }
    }

    // ============ 委托 ============

    TypeRef parseType() { return typeParser.parseType(); }

    Block parseBlock(String message) { return stmtParser.parseBlock(message); }

    Statement parseStatement() { return stmtParser.parseStatement(); }

    Expression parseExpression() { return exprParser.parseExpression(); }

    Expression parseAssignment() { return exprParser.parseAssignment(); }

    Expression parseConditional() { return exprParser.parseConditional(); }
}
