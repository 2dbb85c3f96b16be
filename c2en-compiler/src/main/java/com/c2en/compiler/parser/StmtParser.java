package com.c2en.compiler.parser;

import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.Expression;
import com.c2en.compiler.ast.stmt.*;
import com.c2en.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.c2en.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.enterNesting("Statement nested too deeply");
        try {
            return parseStatementKind();
        } finally {
            parser.exitNesting();
        }
    }

    private Statement parseStatementKind() {
        if (parser.check(LBRACE)) {
            return parseBlock("Expected '{'");
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_DO)) {
            return parseDoWhileStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_SWITCH)) {
            return parseSwitchStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_BREAK)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after break");
            return new BreakStmt(loc);
        }
        if (parser.check(KW_CONTINUE)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after continue");
            return new ContinueStmt(loc);
        }
        if (parser.check(KW_GOTO)) {
            SourceLocation loc = parser.location();
            parser.advance();
            String label = parser.expect(IDENTIFIER, "Expected label name after 'goto'").getLexeme();
            parser.expect(SEMICOLON, "Expected ';' after goto");
            return new GotoStmt(loc, label);
        }
        // 检测标签语法: label: stmt
        if (parser.check(IDENTIFIER)) {
            int mark = parser.mark();
            Token label = parser.advance();
            if (parser.match(COLON)) {
                Statement statement = parseStatement();
                return new LabeledStmt(parser.locationOf(label), label.getLexeme(), statement);
            }
            parser.reset(mark);
        }
        // 声明语句
        if (parser.isTypeStart()) {
            return parseDeclarationStmt("Expected ';' after declaration");
        }

        // 表达式语句
        return parseExpressionStmt();
    }

    /**
     * 解析代码块。块内某条语句出错时记录错误并同步到下一个语句边界，继续解析余下语句。
     */
    Block parseBlock(String message) {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, message);

        List<Statement> statements = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            try {
                addFlattened(statements, parseStatement());
            } catch (ParseException e) {
                parser.recordError(e);
                synchronizeInBlock();
            }
        }

        parser.expect(RBRACE, "Expected '}' after block");
        return new Block(loc, statements);
    }

    /**
     * 块内错误恢复：跳过 token 直到找到语句边界（分号）或块结束（}）
     */
    void synchronizeInBlock() {
        while (!parser.isAtEnd()) {
            if (parser.check(RBRACE)) return;
            if (parser.check(SEMICOLON)) {
                parser.advance();
                return;
            }
            parser.advance();
        }
    }

    private static void addFlattened(List<Statement> statements, Statement statement) {
        if (statement instanceof Block && ((Block) statement).isTransparent()) {
            statements.addAll(((Block) statement).getStatements());
        } else {
            statements.add(statement);
        }
    }

    /**
     * 声明语句；多个声明符时返回透明块
     */
    Statement parseDeclarationStmt(String terminatorMessage) {
        SourceLocation loc = parser.location();
        List<VarDecl> decls = parser.declParser.parseLocalDeclaration(terminatorMessage);
        if (decls.size() == 1) {
            return decls.get(0);
        }
        return new Block(loc, new ArrayList<Statement>(decls), true);
    }

    Statement parseExpressionStmt() {
        SourceLocation loc = parser.location();
        if (parser.match(SEMICOLON)) {
            return new ExpressionStmt(loc, null);
        }
        Expression expr = parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExpressionStmt(loc, expr);
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");

        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        Statement body = parseStatement();
        return new WhileStmt(loc, condition, body);
    }

    private DoWhileStmt parseDoWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_DO, "Expected 'do'");
        Statement body = parseStatement();
        parser.expect(KW_WHILE, "Expected 'while' after do body");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after condition");
        parser.expect(SEMICOLON, "Expected ';' after do-while");
        return new DoWhileStmt(loc, body, condition);
    }

    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        Statement init = null;
        if (parser.isTypeStart()) {
            init = parseDeclarationStmt("Expected ';' after loop initializer");
        } else if (!parser.match(SEMICOLON)) {
            SourceLocation initLoc = parser.location();
            Expression expr = parser.parseExpression();
            parser.expect(SEMICOLON, "Expected ';' after loop initializer");
            init = new ExpressionStmt(initLoc, expr);
        }

        Expression condition = null;
        if (!parser.check(SEMICOLON)) {
            condition = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after loop condition");

        Expression update = null;
        if (!parser.check(RPAREN)) {
            update = parser.parseExpression();
        }
        parser.expect(RPAREN, "Expected ')' after for clauses");

        Statement body = parseStatement();
        return new ForStmt(loc, init, condition, update, body);
    }

    private SwitchStmt parseSwitchStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_SWITCH, "Expected 'switch'");
        parser.expect(LPAREN, "Expected '(' after 'switch'");
        Expression subject = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after switch value");
        parser.expect(LBRACE, "Expected '{' after switch");

        List<CaseClause> clauses = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation caseLoc = parser.location();
            Expression value = null;
            if (parser.match(KW_CASE)) {
                value = parser.parseConditional();
                parser.expect(COLON, "Expected ':' after case value");
            } else if (parser.match(KW_DEFAULT)) {
                parser.expect(COLON, "Expected ':' after 'default'");
            } else {
                throw new ParseException("Expected 'case' or 'default'", parser.current);
            }

            List<Statement> body = new ArrayList<>();
            while (!parser.checkAny(KW_CASE, KW_DEFAULT, RBRACE) && !parser.isAtEnd()) {
                try {
                    addFlattened(body, parseStatement());
                } catch (ParseException e) {
                    parser.recordError(e);
                    synchronizeInBlock();
                }
            }
            clauses.add(new CaseClause(caseLoc, value, body));
        }
        parser.expect(RBRACE, "Expected '}' after switch body");
        return new SwitchStmt(loc, subject, clauses);
    }

    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(loc, value);
    }
}
