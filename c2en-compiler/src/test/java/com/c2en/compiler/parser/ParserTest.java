package com.c2en.compiler.parser;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.decl.*;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.stmt.*;
import com.c2en.compiler.lexer.Lexer;
import com.c2en.compiler.lexer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private static final PrintStream SILENT = new PrintStream(new ByteArrayOutputStream(), true);

    private ParseResult parseResult(String source) {
        List<Token> tokens = new Lexer(source, "test.c", SILENT).scanTokens();
        return new Parser(tokens, "test.c", SILENT).parse();
    }

    private Program parse(String source) {
        ParseResult result = parseResult(source);
        assertTrue(result.isSuccess(), "解析失败: " + result.getErrors());
        return result.getProgram();
    }

    private FunctionDecl function(String source) {
        return parse(source).getFunctionDefinitions().get(0);
    }

    /** 解析 main 函数体中的第一条语句 */
    private Statement firstStatement(String body) {
        return function("int main() { " + body + " }").getBody().getStatements().get(0);
    }

    /** 解析表达式语句中的表达式 */
    private Expression expr(String expression) {
        Statement stmt = function("int main() { int a; " + expression + "; }").getBody().getStatements().get(1);
        return ((ExpressionStmt) stmt).getExpression();
    }

    /** 把 text 重复 n 次 */
    private static String repeat(String text, int n) {
        StringBuilder sb = new StringBuilder(text.length() * n);
        for (int i = 0; i < n; i++) {
            sb.append(text);
        }
        return sb.toString();
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("函数声明")
    class FunctionTests {

        @Test
        @DisplayName("参数与返回类型")
        void testParameters() {
            FunctionDecl f = function("unsigned long sum(const char *s, int values[], int n) { return 0; }");
            assertEquals("sum", f.getName());
            assertEquals("unsigned long", f.getReturnType().displayName());
            assertEquals(3, f.getParams().size());
            assertEquals("const char*", f.getParams().get(0).getType().displayName());
            assertTrue(f.getParams().get(1).isArray());
            assertEquals("n", f.getParams().get(2).getName());
        }

        @Test
        @DisplayName("(void) 参数表等于没有参数")
        void testVoidParameterList() {
            FunctionDecl f = function("int main(void) { return 0; }");
            assertTrue(f.getParams().isEmpty());
            assertFalse(f.isVariadic());
        }

        @Test
        @DisplayName("原型没有函数体，且不计入函数定义")
        void testPrototype() {
            Program program = parse("int square(int);\nint square(int x) { return x * x; }");
            assertEquals(2, program.getDeclarations().size());
            FunctionDecl proto = (FunctionDecl) program.getDeclarations().get(0);
            assertFalse(proto.isDefinition());
            assertNull(proto.getParams().get(0).getName());
            assertEquals(1, program.getFunctionDefinitions().size());
        }

        @Test
        @DisplayName("可变参数")
        void testVariadic() {
            Program program = parse("int log_message(const char *fmt, ...);");
            FunctionDecl f = (FunctionDecl) program.getDeclarations().get(0);
            assertTrue(f.isVariadic());
            assertEquals(1, f.getParams().size());
        }
    }

    @Nested
    @DisplayName("类型定义与全局变量")
    class DeclarationTests {

        @Test
        @DisplayName("结构体定义与成员")
        void testStruct() {
            Program program = parse("struct Point { int x; int y; char label[16]; };");
            StructDecl s = (StructDecl) program.getDeclarations().get(0);
            assertEquals("Point", s.getName());
            assertFalse(s.isUnion());
            assertEquals(3, s.getFields().size());
            assertEquals("16", s.getFields().get(2).getArraySize());
        }

        @Test
        @DisplayName("typedef 匿名结构体以别名命名，别名可作为类型使用")
        void testTypedefStruct() {
            Program program = parse("typedef struct { int x; int y; } Point;\nPoint origin;\n"
                    + "Point make(int x) { Point p; p.x = x; return p; }");
            TypedefDecl typedef = (TypedefDecl) program.getDeclarations().get(0);
            assertEquals("Point", typedef.getAlias());
            assertEquals("Point", ((StructDecl) typedef.getDefinition()).getName());
            VarDecl origin = program.getGlobalVariables().get(0);
            assertEquals("Point", origin.getType().displayName());
            FunctionDecl make = program.getFunctionDefinitions().get(0);
            assertEquals("Point", make.getReturnType().displayName());
            assertTrue(make.getBody().getStatements().get(0) instanceof VarDecl);
        }

        @Test
        @DisplayName("枚举常量与显式取值")
        void testEnum() {
            Program program = parse("enum Colour { RED, GREEN = 5, BLUE, };");
            EnumDecl e = (EnumDecl) program.getDeclarations().get(0);
            assertEquals(3, e.getConstants().size());
            assertNull(e.getConstants().get(0).getValue());
            assertEquals("5", ((Literal) e.getConstants().get(1).getValue()).getText());
        }

        @Test
        @DisplayName("多个声明符展开为多个全局变量")
        void testMultipleGlobals() {
            Program program = parse("static int count = 0, *ptr, table[10];");
            List<VarDecl> globals = program.getGlobalVariables();
            assertEquals(3, globals.size());
            assertTrue(globals.get(0).isStatic());
            assertEquals("int*", globals.get(1).getType().displayName());
            assertTrue(globals.get(2).isArray());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("局部多声明符直接展开到所在代码块")
        void testLocalDeclaratorsFlattened() {
            List<Statement> body = function("int main() { int a, b = 2; return a; }").getBody().getStatements();
            assertEquals(3, body.size());
            assertEquals("a", ((VarDecl) body.get(0)).getName());
            assertEquals("b", ((VarDecl) body.get(1)).getName());
            assertTrue(body.get(2) instanceof ReturnStmt);
        }

        @Test
        @DisplayName("数组声明与初始化列表")
        void testArrayDeclaration() {
            VarDecl decl = (VarDecl) firstStatement("int primes[] = {2, 3, 5};");
            assertTrue(decl.isArray());
            assertNull(decl.getArraySize());
            assertEquals(3, ((InitializerList) decl.getInitializer()).getElements().size());
        }

        @Test
        @DisplayName("if / else 分支")
        void testIfElse() {
            IfStmt stmt = (IfStmt) firstStatement("if (1) return 1; else { return 2; }");
            assertTrue(stmt.getThenBranch() instanceof ReturnStmt);
            assertTrue(stmt.getElseBranch() instanceof Block);
        }

        @Test
        @DisplayName("for 循环：声明初始化与省略的子句")
        void testFor() {
            ForStmt stmt = (ForStmt) firstStatement("for (int i = 0; i < 10; i++) { }");
            assertTrue(stmt.getInit() instanceof VarDecl);
            assertTrue(stmt.getCondition() instanceof BinaryExpr);
            assertEquals(UnaryExpr.UnaryOp.POST_INC, ((UnaryExpr) stmt.getUpdate()).getOperator());

            ForStmt forever = (ForStmt) firstStatement("for (;;) break;");
            assertNull(forever.getInit());
            assertNull(forever.getCondition());
            assertNull(forever.getUpdate());
        }

        @Test
        @DisplayName("do-while")
        void testDoWhile() {
            DoWhileStmt stmt = (DoWhileStmt) firstStatement("do { continue; } while (0);");
            assertTrue(stmt.getBody() instanceof Block);
        }

        @Test
        @DisplayName("switch 的 case 与 default")
        void testSwitch() {
            SwitchStmt stmt = (SwitchStmt) firstStatement(
                    "switch (1) { case 1: case 2: return 1; default: return 0; }");
            List<CaseClause> clauses = stmt.getClauses();
            assertEquals(3, clauses.size());
            assertTrue(clauses.get(0).getBody().isEmpty());
            assertEquals(1, clauses.get(1).getBody().size());
            assertTrue(clauses.get(2).isDefault());
        }

        @Test
        @DisplayName("标签与 goto")
        void testLabels() {
            List<Statement> body = function("int main() { goto done; done: return 0; }")
                    .getBody().getStatements();
            assertEquals("done", ((GotoStmt) body.get(0)).getLabel());
            LabeledStmt label = (LabeledStmt) body.get(1);
            assertEquals("done", label.getLabel());
            assertTrue(label.getStatement() instanceof ReturnStmt);
        }

        @Test
        @DisplayName("空语句")
        void testEmptyStatement() {
            ExpressionStmt stmt = (ExpressionStmt) firstStatement(";");
            assertNull(stmt.getExpression());
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr e = (BinaryExpr) expr("a + a * 2");
            assertEquals(BinaryExpr.BinaryOp.ADD, e.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) e.getRight()).getOperator());
        }

        @Test
        @DisplayName("减法左结合")
        void testLeftAssociative() {
            BinaryExpr e = (BinaryExpr) expr("a - 1 - 2");
            assertTrue(e.getLeft() instanceof BinaryExpr);
            assertEquals("2", ((Literal) e.getRight()).getText());
        }

        @Test
        @DisplayName("赋值右结合")
        void testAssignmentRightAssociative() {
            AssignExpr e = (AssignExpr) expr("a = a = 1");
            assertTrue(e.getValue() instanceof AssignExpr);
        }

        @Test
        @DisplayName("逻辑运算符优先级：&& 高于 ||")
        void testLogicalPrecedence() {
            BinaryExpr e = (BinaryExpr) expr("a || a && a");
            assertEquals(BinaryExpr.BinaryOp.OR, e.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) e.getRight()).getOperator());
        }

        @Test
        @DisplayName("三元、复合赋值与移位")
        void testConditionalAndCompound() {
            assertTrue(expr("a > 0 ? a : -a") instanceof ConditionalExpr);
            AssignExpr compound = (AssignExpr) expr("a <<= 2");
            assertEquals(AssignExpr.AssignOp.SHL_ASSIGN, compound.getOperator());
            assertTrue(compound.isCompound());
        }

        @Test
        @DisplayName("后缀：下标、成员访问和函数调用")
        void testPostfix() {
            MemberExpr member = (MemberExpr) expr("a->next.value");
            assertFalse(member.isArrow());
            assertTrue(((MemberExpr) member.getTarget()).isArrow());

            CallExpr call = (CallExpr) expr("printf(\"%d\", a[0])");
            assertEquals("printf", call.getCallee());
            assertTrue(call.getArgs().get(1) instanceof IndexExpr);
        }

        @Test
        @DisplayName("sizeof 与类型转换")
        void testSizeofAndCast() {
            SizeofExpr sizeofType = (SizeofExpr) expr("sizeof(int)");
            assertTrue(sizeofType.isTypeOperand());
            SizeofExpr sizeofExpr = (SizeofExpr) expr("sizeof a");
            assertFalse(sizeofExpr.isTypeOperand());
            CastExpr cast = (CastExpr) expr("(char *) a");
            assertEquals("char*", cast.getTargetType().displayName());
        }

        @Test
        @DisplayName("相邻字符串字面量合并")
        void testStringConcatenation() {
            CallExpr call = (CallExpr) expr("puts(\"Hello, \" \"world\")");
            assertEquals("\"Hello, world\"", ((Literal) call.getArgs().get(0)).getText());
        }

        @Test
        @DisplayName("一元运算符")
        void testUnary() {
            UnaryExpr deref = (UnaryExpr) expr("*&a");
            assertEquals(UnaryExpr.UnaryOp.DEREF, deref.getOperator());
            assertEquals(UnaryExpr.UnaryOp.ADDRESS_OF, ((UnaryExpr) deref.getOperand()).getOperator());
            assertEquals(UnaryExpr.UnaryOp.PRE_DEC, ((UnaryExpr) expr("--a")).getOperator());
        }
    }

    // ================================================================
    // 错误恢复
    // ================================================================

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("缺少分号：报告位置并且不交出语法树")
        void testMissingSemicolon() {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            PrintStream err = new PrintStream(baos, true, StandardCharsets.UTF_8);
            List<Token> tokens = new Lexer("int main() { return 0 }", "test.c", err).scanTokens();
            ParseResult result = new Parser(tokens, "test.c", err).parse();

            assertFalse(result.isSuccess());
            assertNull(result.getProgram());
            assertEquals(1, result.getErrors().size());
            assertEquals("[ERROR] test.c:1:23: Expected ';' after return",
                    baos.toString(StandardCharsets.UTF_8).trim());
        }

        @Test
        @DisplayName("块内错误恢复后继续解析后续语句与函数")
        void testRecoveryCollectsMultipleErrors() {
            ParseResult result = parseResult(
                    "int f() { int = 1; return 0; }\n"
                    + "int g() { return ; }\n"
                    + "int h( { }\n"
                    + "int k() { return 1 + ; }");
            assertTrue(result.getErrors().size() >= 3, "errors: " + result.getErrors());
            assertNull(result.getProgram());
        }

        @Test
        @DisplayName("只能调用具名函数")
        void testOnlyNamedCalls() {
            ParseResult result = parseResult("int main() { int a[2]; a[0](1); return 0; }");
            assertEquals("Only named functions can be called", result.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("任意输入都能终止")
        void testTerminatesOnGarbage() {
            String[] inputs = {"}}} {{{ ;;;", "int", "int f(", "struct {", "typedef", "((((", "int main() {"};
            for (String input : inputs) {
                ParseResult result = parseResult(input);
                assertFalse(result.isSuccess(), "should fail: " + input);
            }
        }

        @Test
        @DisplayName("括号嵌套过深：报告语法错误而不是栈溢出")
        void testDeeplyNestedParentheses() {
            String source = "int main() { return " + repeat("(", 20000) + "1" + repeat(")", 20000) + "; }";
            ParseResult result = parseResult(source);
            assertFalse(result.isSuccess());
            assertEquals("Expression nested too deeply", result.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("长串右结合赋值与一元运算同样受深度限制")
        void testDeepRightRecursion() {
            ParseResult assignments = parseResult("int main() { int a; " + repeat("a = ", 20000) + "1; }");
            assertEquals("Expression nested too deeply", assignments.getErrors().get(0).getMessage());

            ParseResult negations = parseResult("int main() { return " + repeat("-", 20000) + "1; }");
            assertEquals("Expression nested too deeply", negations.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("代码块嵌套过深")
        void testDeeplyNestedBlocks() {
            String source = "int main() { " + repeat("{", 20000) + repeat("}", 20000) + " return 0; }";
            ParseResult result = parseResult(source);
            assertFalse(result.isSuccess());
            assertEquals("Statement nested too deeply", result.getErrors().get(0).getMessage());
        }

        @Test
        @DisplayName("限制以内的嵌套正常解析")
        void testModerateNesting() {
            Program program = parse("int main() { int a; a = " + repeat("(", 60) + "a" + repeat(")", 60) + "; "
                    + repeat("if (a) ", 60) + "a = 1; return a; }");
            assertEquals(4, program.getFunctionDefinitions().get(0).getBody().getStatements().size());
        }

        @Test
        @DisplayName("空文件解析为空程序")
        void testEmptyProgram() {
            Program program = parse("");
            assertTrue(program.getDeclarations().isEmpty());
        }
    }

    @Test
    @DisplayName("顶层声明保持源码顺序")
    void testDeclarationOrder() {
        Program program = parse("int g;\nint a() { return 0; }\nstruct S { int x; };\nint b() { return 1; }");
        List<AstNode> decls = program.getDeclarations();
        assertTrue(decls.get(0) instanceof VarDecl);
        assertEquals("a", ((FunctionDecl) decls.get(1)).getName());
        assertTrue(decls.get(2) instanceof StructDecl);
        assertEquals("b", ((FunctionDecl) decls.get(3)).getName());
    }
}
