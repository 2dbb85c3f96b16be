package com.c2en.compiler.translator;

/**
 * 翻译输出配置
 */
public class TranslationConfig {
    private int indentSize = 2;
    private String bullet = "•";
    private boolean includeGlobalDefinitions = true;

    public TranslationConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public TranslationConfig setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
        return this;
    }

    /** 参数列表与全局定义列表的项目符号 */
    public String getBullet() {
        return bullet;
    }

    public TranslationConfig setBullet(String bullet) {
        this.bullet = bullet;
        return this;
    }

    /** 是否输出结构体、枚举、类型别名和全局变量一节 */
    public boolean isIncludeGlobalDefinitions() {
        return includeGlobalDefinitions;
    }

    public TranslationConfig setIncludeGlobalDefinitions(boolean includeGlobalDefinitions) {
        this.includeGlobalDefinitions = includeGlobalDefinitions;
        return this;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
