package com.c2en.compiler.lexer;

import com.c2en.compiler.parser.ParseResult;
import com.c2en.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    private static final PrintStream SILENT = new PrintStream(new ByteArrayOutputStream(), true);

    /** 扫描源码，返回所有 token（含 EOF / ERROR） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>", SILENT).scanTokens();
    }

    /** 扫描源码，返回除 EOF 外的 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    /** 扫描源码，捕获错误输出 */
    private String scanWithErrors(String source) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos, true, StandardCharsets.UTF_8);
        new Lexer(source, "test.c", ps).scanTokens();
        return baos.toString(StandardCharsets.UTF_8);
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<TokenType> toks = types(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0));
    }

    @Nested
    @DisplayName("运算符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("单字符 token")
        void testSingleChars() {
            assertSingleToken("(", TokenType.LPAREN);
            assertSingleToken("}", TokenType.RBRACE);
            assertSingleToken(";", TokenType.SEMICOLON);
            assertSingleToken("?", TokenType.QUESTION);
            assertSingleToken("~", TokenType.TILDE);
        }

        @Test
        @DisplayName("最长匹配：多字符运算符优先")
        void testMaximalMunch() {
            assertSingleToken("<<=", TokenType.SHL_ASSIGN);
            assertSingleToken(">>=", TokenType.SHR_ASSIGN);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("...", TokenType.ELLIPSIS);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("++", TokenType.INC);
            assertSingleToken("!=", TokenType.NE);
            assertEquals(java.util.Arrays.asList(TokenType.INC, TokenType.PLUS), types("+++"));
        }

        @Test
        @DisplayName("复合赋值运算符")
        void testCompoundAssignment() {
            assertEquals(java.util.Arrays.asList(
                    TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MUL_ASSIGN,
                    TokenType.DIV_ASSIGN, TokenType.MOD_ASSIGN, TokenType.AND_ASSIGN,
                    TokenType.OR_ASSIGN, TokenType.XOR_ASSIGN),
                    types("+= -= *= /= %= &= |= ^="));
            for (TokenType t : types("+= -= *= /= %= &= |= ^= <<= >>= =")) {
                assertTrue(t.isAssignmentOp(), t + " should be an assignment operator");
            }
        }

        @Test
        @DisplayName("单独的点号与省略号区分")
        void testDotVersusEllipsis() {
            assertEquals(java.util.Arrays.asList(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER),
                    types("p.x"));
        }
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("类型关键词")
        void testTypeKeywords() {
            assertSingleToken("int", TokenType.KW_INT);
            assertSingleToken("unsigned", TokenType.KW_UNSIGNED);
            assertSingleToken("struct", TokenType.KW_STRUCT);
            assertSingleToken("typedef", TokenType.KW_TYPEDEF);
            assertTrue(TokenType.KW_CHAR.isTypeStart());
            assertFalse(TokenType.KW_RETURN.isTypeStart());
        }

        @Test
        @DisplayName("控制流关键词")
        void testControlKeywords() {
            assertEquals(java.util.Arrays.asList(TokenType.KW_IF, TokenType.KW_ELSE, TokenType.KW_WHILE,
                    TokenType.KW_DO, TokenType.KW_FOR, TokenType.KW_SWITCH, TokenType.KW_CASE,
                    TokenType.KW_DEFAULT, TokenType.KW_GOTO, TokenType.KW_SIZEOF),
                    types("if else while do for switch case default goto sizeof"));
        }

        @Test
        @DisplayName("关键词前缀的标识符不是关键词")
        void testKeywordPrefix() {
            List<Token> toks = scan("integer _tmp1 returnValue");
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertEquals("integer", toks.get(0).getLexeme());
            assertEquals(TokenType.IDENTIFIER, toks.get(1).getType());
            assertEquals(TokenType.IDENTIFIER, toks.get(2).getType());
        }
    }

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与小数")
        void testNumbers() {
            List<Token> toks = scan("42 3.14 7.");
            assertEquals("42", toks.get(0).getLexeme());
            assertEquals("3.14", toks.get(1).getLexeme());
            // 小数点后没有数字时，点号单独成 token
            assertEquals("7", toks.get(2).getLexeme());
            assertEquals(TokenType.DOT, toks.get(3).getType());
        }

        @Test
        @DisplayName("小数点两侧都必须有数字：1. 和 .5 都不是一个数")
        void testDotRequiresDigitsOnBothSides() {
            assertEquals(Arrays.asList(TokenType.KW_DOUBLE, TokenType.IDENTIFIER, TokenType.ASSIGN,
                    TokenType.NUMBER, TokenType.DOT, TokenType.SEMICOLON), types("double d = 1.;"));
            assertEquals(Arrays.asList(TokenType.DOT, TokenType.NUMBER), types(".5"));

            // 于是 1. 作为成员访问交给语法分析报错
            List<Token> tokens = scan("int main() { double d = 1.; return 0; }");
            ParseResult result = new Parser(tokens, "<test>", SILENT).parse();
            assertFalse(result.isSuccess());
            assertEquals("Expected member name after '.'", result.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("字符串保留引号与转义原文")
        void testStringLexeme() {
            List<Token> toks = scan("\"Hello, \\\"world\\\"\\n\"");
            assertEquals(TokenType.STRING_LITERAL, toks.get(0).getType());
            assertEquals("\"Hello, \\\"world\\\"\\n\"", toks.get(0).getLexeme());
        }

        @Test
        @DisplayName("字符字面量")
        void testCharLiteral() {
            List<Token> toks = scan("'a' '\\n' '\\''");
            assertEquals("'a'", toks.get(0).getLexeme());
            assertEquals("'\\n'", toks.get(1).getLexeme());
            assertEquals("'\\''", toks.get(2).getLexeme());
            assertEquals(TokenType.CHAR_LITERAL, toks.get(2).getType());
        }
    }

    @Nested
    @DisplayName("空白、注释与预处理指令")
    class TriviaTests {

        @Test
        @DisplayName("注释和空白不影响 token 类型序列")
        void testCommentsAreIgnored() {
            List<TokenType> plain = types("int x = 1;");
            List<TokenType> noisy = types("int /* a */ x\n\t= // b\n 1 /**/ ;");
            assertEquals(plain, noisy);
        }

        @Test
        @DisplayName("预处理指令整行跳过，支持反斜杠续行")
        void testDirectives() {
            List<TokenType> toks = types("#include <stdio.h>\n#define MAX(a, b) \\\n  ((a) > (b))\nint x;");
            assertEquals(java.util.Arrays.asList(TokenType.KW_INT, TokenType.IDENTIFIER, TokenType.SEMICOLON),
                    toks);
        }

        @Test
        @DisplayName("行列号从 1 开始计数")
        void testLineAndColumn() {
            List<Token> toks = scan("int a;\n  return");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(5, toks.get(1).getColumn());
            Token ret = toks.get(3);
            assertEquals(TokenType.KW_RETURN, ret.getType());
            assertEquals(2, ret.getLine());
            assertEquals(3, ret.getColumn());
        }

        @Test
        @DisplayName("词素拼接后重新扫描得到相同的类型序列")
        void testRoundTrip() {
            String source = "int main(void) { int a[3] = {1, 2, 3}; a[0] <<= 2; return a[0] ? -1 : 0; }";
            List<Token> toks = scan(source);
            StringBuilder rebuilt = new StringBuilder();
            for (Token t : toks) {
                rebuilt.append(t.getLexeme()).append(' ');
            }
            assertEquals(types(source), types(rebuilt.toString()));
        }

        @Test
        @DisplayName("正常结束时以唯一的 EOF 结尾")
        void testEndsWithEof() {
            List<Token> toks = scan("x");
            assertEquals(TokenType.EOF, toks.get(toks.size() - 1).getType());
            assertEquals(1, toks.stream().filter(t -> t.is(TokenType.EOF)).count());
        }
    }

    @Nested
    @DisplayName("词法错误")
    class ErrorTests {

        @Test
        @DisplayName("未闭合的字符串在行尾报错并停止扫描")
        void testUnterminatedString() {
            Lexer lexer = new Lexer("char *s = \"abc;\nint y;", "<test>", SILENT);
            List<Token> toks = lexer.scanTokens();
            assertTrue(lexer.hasError());
            Token last = toks.get(toks.size() - 1);
            assertEquals(TokenType.ERROR, last.getType());
            assertEquals("Unterminated string", last.getLexeme());
            assertFalse(toks.stream().anyMatch(t -> t.is(TokenType.EOF)));
        }

        @Test
        @DisplayName("未闭合的字符字面量")
        void testUnterminatedChar() {
            List<Token> toks = scan("char c = 'a");
            assertEquals("Unterminated character literal", toks.get(toks.size() - 1).getLexeme());
        }

        @Test
        @DisplayName("未闭合的块注释报告为词法错误")
        void testUnterminatedBlockComment() {
            List<Token> toks = scan("int x; /* never closed");
            Token last = toks.get(toks.size() - 1);
            assertEquals(TokenType.ERROR, last.getType());
            assertEquals("Unterminated block comment", last.getLexeme());
            assertEquals(8, last.getColumn());
        }

        @Test
        @DisplayName("非法字符的错误格式")
        void testUnexpectedCharacterMessage() {
            String err = scanWithErrors("int x = 1;\nint @y;");
            assertEquals("[ERROR] test.c:2:5: Lexical error: Unexpected character: '@'", err.trim());
        }
    }
}
