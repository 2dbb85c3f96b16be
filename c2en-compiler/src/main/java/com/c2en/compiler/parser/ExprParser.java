package com.c2en.compiler.parser;

import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.c2en.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.c2en.compiler.ast.type.TypeRef;
import com.c2en.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.c2en.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：赋值 → 三元 → || → && → | → ^ → & → 相等 → 关系 → 移位
 * → 加减 → 乘除余 → 前缀一元 → 后缀 → 基本表达式。</p>
 */
class ExprParser {

    static final String TOO_DEEP = "Expression nested too deeply";

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignment();
    }

    // 赋值表达式（最低优先级，右结合）
    Expression parseAssignment() {
        Expression left = parseConditional();

        if (parser.current.getType().isAssignmentOp()) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right;
            parser.enterNesting(TOO_DEEP);
            try {
                right = parseAssignment();  // 右结合
            } finally {
                parser.exitNesting();
            }
            return new AssignExpr(loc, left, AssignExpr.AssignOp.fromToken(op.getType()), right);
        }

        return left;
    }

    // 三元表达式（右结合）。括号、实参和三元分支的递归都经过这里，在此计入嵌套深度
    Expression parseConditional() {
        parser.enterNesting(TOO_DEEP);
        try {
            Expression condition = parseLogicalOr();

            if (parser.match(QUESTION)) {
                SourceLocation loc = parser.previousLocation();
                Expression thenExpr = parseExpression();
                parser.expect(COLON, "Expected ':' in conditional expression");
                Expression elseExpr = parseConditional();
                return new ConditionalExpr(loc, condition, thenExpr, elseExpr);
            }

            return condition;
        } finally {
            parser.exitNesting();
        }
    }

    // ||
    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();
        while (parser.check(OR)) {
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.OR, parseLogicalAnd());
        }
        return left;
    }

    // &&
    private Expression parseLogicalAnd() {
        Expression left = parseBitwiseOr();
        while (parser.check(AND)) {
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.AND, parseBitwiseOr());
        }
        return left;
    }

    // |
    private Expression parseBitwiseOr() {
        Expression left = parseBitwiseXor();
        while (parser.check(PIPE)) {
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_OR, parseBitwiseXor());
        }
        return left;
    }

    // ^
    private Expression parseBitwiseXor() {
        Expression left = parseBitwiseAnd();
        while (parser.check(CARET)) {
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_XOR, parseBitwiseAnd());
        }
        return left;
    }

    // &
    private Expression parseBitwiseAnd() {
        Expression left = parseEquality();
        while (parser.check(AMPERSAND)) {
            parser.advance();
            SourceLocation loc = parser.previousLocation();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_AND, parseEquality());
        }
        return left;
    }

    // == !=
    private Expression parseEquality() {
        Expression left = parseRelational();
        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp = op.is(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            left = new BinaryExpr(loc, left, binOp, parseRelational());
        }
        return left;
    }

    // < <= > >=
    private Expression parseRelational() {
        Expression left = parseShift();
        while (parser.checkAny(LT, LE, GT, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryOp.LT; break;
                case LE: binOp = BinaryOp.LE; break;
                case GT: binOp = BinaryOp.GT; break;
                default: binOp = BinaryOp.GE; break;
            }
            left = new BinaryExpr(loc, left, binOp, parseShift());
        }
        return left;
    }

    // << >>
    private Expression parseShift() {
        Expression left = parseAdditive();
        while (parser.checkAny(SHL, SHR)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp = op.is(SHL) ? BinaryOp.SHL : BinaryOp.SHR;
            left = new BinaryExpr(loc, left, binOp, parseAdditive());
        }
        return left;
    }

    // + -
    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp = op.is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, parseMultiplicative());
        }
        return left;
    }

    // 乘除余 * / %
    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(STAR, SLASH, PERCENT)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            BinaryOp binOp;
            switch (op.getType()) {
                case STAR: binOp = BinaryOp.MUL; break;
                case SLASH: binOp = BinaryOp.DIV; break;
                default: binOp = BinaryOp.MOD; break;
            }
            left = new BinaryExpr(loc, left, binOp, parseUnary());
        }
        return left;
    }

    // 前缀一元 ! - + ++ -- & ~ *，以及 sizeof 和类型转换
    private Expression parseUnary() {
        parser.enterNesting(TOO_DEEP);
        try {
            return parsePrefixed();
        } finally {
            parser.exitNesting();
        }
    }

    private Expression parsePrefixed() {
        SourceLocation loc = parser.location();
        UnaryOp op = prefixOp();
        if (op != null) {
            parser.advance();
            return new UnaryExpr(loc, op, parseUnary());
        }
        if (parser.match(KW_SIZEOF)) {
            if (parser.check(LPAREN) && parser.isTypeStartAhead()) {
                parser.advance();
                TypeRef type = parser.parseType();
                parser.expect(RPAREN, "Expected ')' after type");
                return new SizeofExpr(loc, type, null);
            }
            return new SizeofExpr(loc, null, parseUnary());
        }
        if (parser.check(LPAREN) && parser.isTypeStartAhead()) {
            parser.advance();
            TypeRef type = parser.parseType();
            parser.expect(RPAREN, "Expected ')' after type");
            return new CastExpr(loc, type, parseUnary());
        }
        return parsePostfix();
    }

    private UnaryOp prefixOp() {
        switch (parser.current.getType()) {
            case NOT:       return UnaryOp.NOT;
            case MINUS:     return UnaryOp.NEG;
            case PLUS:      return UnaryOp.POS;
            case INC:       return UnaryOp.PRE_INC;
            case DEC:       return UnaryOp.PRE_DEC;
            case AMPERSAND: return UnaryOp.ADDRESS_OF;
            case TILDE:     return UnaryOp.BIT_NOT;
            case STAR:      return UnaryOp.DEREF;
            default:        return null;
        }
    }

    // 后缀 . -> [] ++ -- 与函数调用
    private Expression parsePostfix() {
        Expression expr = parsePrimary();

        while (true) {
            if (parser.check(LPAREN)) {
                if (!(expr instanceof Identifier)) {
                    throw new ParseException("Only named functions can be called", parser.current);
                }
                parser.advance();
                expr = finishCall((Identifier) expr);
            } else if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after array index");
                expr = new IndexExpr(expr.getLocation(), expr, index);
            } else if (parser.match(DOT)) {
                String member = parser.expect(IDENTIFIER, "Expected member name after '.'").getLexeme();
                expr = new MemberExpr(expr.getLocation(), expr, member, false);
            } else if (parser.match(ARROW)) {
                String member = parser.expect(IDENTIFIER, "Expected member name after '->'").getLexeme();
                expr = new MemberExpr(expr.getLocation(), expr, member, true);
            } else if (parser.match(INC)) {
                expr = new UnaryExpr(expr.getLocation(), UnaryOp.POST_INC, expr);
            } else if (parser.match(DEC)) {
                expr = new UnaryExpr(expr.getLocation(), UnaryOp.POST_DEC, expr);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expression finishCall(Identifier callee) {
        List<Expression> args = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            do {
                args.add(parseAssignment());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return new CallExpr(callee.getLocation(), callee.getName(), args);
    }

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();

        if (parser.check(NUMBER)) {
            return new Literal(loc, parser.advance().getLexeme(), Literal.LiteralKind.NUMBER);
        }
        if (parser.check(STRING_LITERAL)) {
            StringBuilder text = new StringBuilder(parser.advance().getLexeme());
            // 相邻字符串字面量拼接 "a" "b"
            while (parser.check(STRING_LITERAL)) {
                String next = parser.advance().getLexeme();
                text.setLength(text.length() - 1);
                text.append(next, 1, next.length());
            }
            return new Literal(loc, text.toString(), Literal.LiteralKind.STRING);
        }
        if (parser.check(CHAR_LITERAL)) {
            return new Literal(loc, parser.advance().getLexeme(), Literal.LiteralKind.CHAR);
        }
        if (parser.check(IDENTIFIER)) {
            return new Identifier(loc, parser.advance().getLexeme());
        }
        if (parser.match(LPAREN)) {
            Expression expr = parseExpression();
            parser.expect(RPAREN, "Expected ')' after expression");
            return expr;
        }

        throw new ParseException("Expected expression", parser.current);
    }
}
