package com.c2en.compiler.translator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 翻译上下文，跟踪输出缓冲区、缩进层级、步骤编号和所在的可跳出结构
 */
public class TranslationContext {
    private final StringBuilder output = new StringBuilder();
    private final TranslationConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;
    private int pendingStep = 0;
    private final Deque<Breakable> breakables = new ArrayDeque<>();

    /** break 能跳出的结构 */
    public enum Breakable {
        LOOP,
        SWITCH
    }

    public TranslationContext(TranslationConfig config) {
        this.config = config;
    }

    public TranslationConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 追加空行。空行不带缩进，也不会连续出现。
     */
    public void blankLine() {
        int length = output.length();
        if (length == 0) {
            return;
        }
        if (length >= 2 && output.charAt(length - 1) == '\n' && output.charAt(length - 2) == '\n') {
            return;
        }
        if (output.charAt(length - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    // ============ 步骤编号 ============

    /**
     * 设置下一条语句的步骤号，0 表示不编号
     */
    public void setPendingStep(int step) {
        this.pendingStep = step;
    }

    /**
     * 取出步骤前缀（如 {@code "3. "}）并清除，未编号时返回空串
     */
    public String takeStepPrefix() {
        int step = pendingStep;
        pendingStep = 0;
        return step > 0 ? step + ". " : "";
    }

    // ============ break 目标 ============

    public void enter(Breakable breakable) {
        breakables.push(breakable);
    }

    public void exit() {
        breakables.pop();
    }

    /** 最内层的可跳出结构，不在循环或 switch 中时返回 null */
    public Breakable innermostBreakable() {
        return breakables.peek();
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
