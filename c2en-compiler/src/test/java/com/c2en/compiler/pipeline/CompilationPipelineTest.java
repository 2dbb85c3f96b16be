package com.c2en.compiler.pipeline;

import com.c2en.compiler.analysis.SemanticDiagnostic;
import com.c2en.compiler.lexer.TokenType;
import com.c2en.compiler.translator.TranslationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译流水线端到端测试
 */
class CompilationPipelineTest {

    private ByteArrayOutputStream errBuffer;
    private CompilationPipeline pipeline;

    @BeforeEach
    void setUp() {
        errBuffer = new ByteArrayOutputStream();
        pipeline = new CompilationPipeline(new TranslationConfig(),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private String errors() {
        return new String(errBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    /** 从测试资源读取示例源码 */
    private String loadSample(String name) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("samples/" + name)) {
            assertNotNull(in, "missing sample " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("成功编译")
    class SuccessTests {

        @Test
        @DisplayName("空函数编译成功且不输出诊断")
        void testEmptyFunction() {
            CompilationResult result = pipeline.compile("void g(){}", "g.c");
            assertTrue(result.isSuccess());
            assertNull(result.getFailedStage());
            assertNotNull(result.getProgram());
            assertTrue(result.getOutput().contains(
                    "This function accepts no parameters and returns a value of type void."));
            assertEquals("", errors());
        }

        @Test
        @DisplayName("示例程序完整通过四个阶段")
        void testSample() throws IOException {
            CompilationResult result = pipeline.compile(loadSample("inventory.c"), "inventory.c");
            assertTrue(result.isSuccess(), errors());
            String output = result.getOutput();
            assertTrue(output.startsWith("Programme Description\n"));
            assertTrue(output.contains("This programme consists of 3 functions."));
            assertTrue(output.contains("Structure 'Item' with 2 members:"));
            assertTrue(output.contains("Enumeration 'Status' with the constants 'EMPTY', 'LOW' (the value 5) and 'STOCKED'."));
            assertTrue(output.contains("Declare a variable named 'item_count' of type int, initialised to the value 0, "
                    + "which keeps its value between calls."));
            assertTrue(output.contains("one parameter named 'quantity' of type int"));
            assertTrue(output.contains("When it equals the value 1 or the value 2:"));
            assertTrue(output.contains("Display the message \"Total: %d\\n\"."));
            assertTrue(output.contains("Release previously allocated memory."));
            assertTrue(output.contains("This is the main entry point of the programme."));
            assertFalse(output.contains("MAX_ITEMS"));
        }

        @Test
        @DisplayName("Token 列表以 EOF 结尾，指令与注释不产生 token")
        void testTokensKept() {
            CompilationResult result = pipeline.compile("#include <stdio.h>\n/* c */ int x;", "t.c");
            assertTrue(result.isSuccess());
            assertEquals(TokenType.KW_INT, result.getTokens().get(0).getType());
            assertEquals(TokenType.EOF, result.getTokens().get(result.getTokens().size() - 1).getType());
        }
    }

    @Nested
    @DisplayName("阶段失败")
    class FailureTests {

        @Test
        @DisplayName("重复声明在语义检查阶段失败")
        void testDuplicateDeclaration() {
            CompilationResult result = pipeline.compile("int main(){int x; int x; return 0;}", "dup.c");
            assertFalse(result.isSuccess());
            assertEquals(CompilationStage.CHECK, result.getFailedStage());
            assertNotNull(result.getProgram());
            assertNull(result.getOutput());
            assertEquals(1, result.getDiagnostics().size());
            assertEquals(SemanticDiagnostic.Kind.DUPLICATE_DECLARATION, result.getDiagnostics().get(0).getKind());
            assertTrue(errors().contains("Variable 'x' already declared in this scope"));
        }

        @Test
        @DisplayName("未声明变量在语义检查阶段失败")
        void testUndeclaredVariable() {
            CompilationResult result = pipeline.compile("int main(){ return y; }", "undeclared.c");
            assertEquals(CompilationStage.CHECK, result.getFailedStage());
            assertTrue(errors().contains("[SEMANTIC ERROR] undeclared.c:1: Undeclared variable 'y'"));
        }

        @Test
        @DisplayName("未终止字符串在词法阶段停止，后续阶段不执行")
        void testUnterminatedString() {
            CompilationResult result = pipeline.compile("int main(){ char *s = \"abc; }", "str.c");
            assertEquals(CompilationStage.LEX, result.getFailedStage());
            assertNull(result.getProgram());
            assertTrue(result.getParseErrors().isEmpty());
            assertTrue(result.getDiagnostics().isEmpty());
            assertTrue(errors().contains("Lexical error: Unterminated string"));
            assertFalse(errors().contains("SEMANTIC"));
        }

        @Test
        @DisplayName("语法错误在语法阶段停止")
        void testSyntaxError() {
            CompilationResult result = pipeline.compile("int main() { return 0 }", "syntax.c");
            assertEquals(CompilationStage.PARSE, result.getFailedStage());
            assertNull(result.getProgram());
            assertFalse(result.getParseErrors().isEmpty());
            assertTrue(errors().contains("Expected ';' after return"));
        }

        @Test
        @DisplayName("失败阶段的提示信息")
        void testStageMessages() {
            assertEquals("Lexical analysis failed", CompilationStage.LEX.getFailureMessage());
            assertEquals("Syntax analysis failed", CompilationStage.PARSE.getFailureMessage());
            assertEquals("Semantic analysis failed", CompilationStage.CHECK.getFailureMessage());
            assertEquals("check", CompilationStage.CHECK.getDisplayName());
        }
    }
}
