package com.c2en.compiler.translator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 输出缓冲区与文本工具测试
 */
class TranslationContextTest {

    @Test
    @DisplayName("缩进只加在行首")
    void testIndentation() {
        TranslationContext ctx = new TranslationContext(new TranslationConfig().setIndentSize(3));
        ctx.line("a");
        ctx.indent();
        ctx.append("b");
        ctx.append("c");
        ctx.newLine();
        ctx.dedent();
        ctx.dedent();
        assertEquals(0, ctx.getIndentLevel());
        ctx.line("d");
        assertEquals("a\n   bc\nd\n", ctx.getOutput());
    }

    @Test
    @DisplayName("空行不重复，文档开头不输出空行")
    void testBlankLine() {
        TranslationContext ctx = new TranslationContext(new TranslationConfig());
        ctx.blankLine();
        ctx.indent();
        ctx.append("x");
        ctx.blankLine();
        ctx.blankLine();
        ctx.line("y");
        assertEquals("  x\n\n  y\n", ctx.getOutput());
    }

    @Test
    @DisplayName("步骤前缀取出一次后清除")
    void testStepPrefix() {
        TranslationContext ctx = new TranslationContext(new TranslationConfig());
        assertEquals("", ctx.takeStepPrefix());
        ctx.setPendingStep(4);
        assertEquals("4. ", ctx.takeStepPrefix());
        assertEquals("", ctx.takeStepPrefix());
    }

    @Test
    @DisplayName("break 目标栈")
    void testBreakables() {
        TranslationContext ctx = new TranslationContext(new TranslationConfig());
        assertNull(ctx.innermostBreakable());
        ctx.enter(TranslationContext.Breakable.LOOP);
        ctx.enter(TranslationContext.Breakable.SWITCH);
        assertEquals(TranslationContext.Breakable.SWITCH, ctx.innermostBreakable());
        ctx.exit();
        assertEquals(TranslationContext.Breakable.LOOP, ctx.innermostBreakable());
    }

    @Test
    @DisplayName("负的缩进宽度被拒绝")
    void testNegativeIndent() {
        assertThrows(IllegalArgumentException.class, () -> new TranslationConfig().setIndentSize(-1));
    }

    @Test
    @DisplayName("列表连接与数量短语")
    void testProseText() {
        assertEquals("", ProseText.joinWithAnd(Collections.<String>emptyList()));
        assertEquals("a", ProseText.joinWithAnd(Collections.singletonList("a")));
        assertEquals("a and b", ProseText.joinWithAnd(Arrays.asList("a", "b")));
        assertEquals("a, b and c", ProseText.joinWithAnd(Arrays.asList("a", "b", "c")));
        assertEquals("a, b or c", ProseText.joinWithOr(Arrays.asList("a", "b", "c")));
        assertEquals("no members", ProseText.count(0, "member", "members"));
        assertEquals("one member", ProseText.count(1, "member", "members"));
        assertEquals("7 members", ProseText.count(7, "member", "members"));
        assertEquals("Set x", ProseText.capitalize("set x"));
        assertEquals("'x'", ProseText.capitalize("'x'"));
        assertEquals("----", ProseText.underline("abcd", '-'));
    }
}
