package com.c2en.compiler.translator;

import java.util.List;

/**
 * 英文文本拼装工具
 */
public final class ProseText {

    private ProseText() {}

    /** 首字母大写 */
    public static String capitalize(String text) {
        if (text == null || text.isEmpty()) return text;
        char first = text.charAt(0);
        if (first >= 'a' && first <= 'z') {
            return Character.toUpperCase(first) + text.substring(1);
        }
        return text;
    }

    /** 名字加单引号：x → 'x' */
    public static String quote(String name) {
        return "'" + name + "'";
    }

    /** 与给定文本等长的下划线 */
    public static String underline(String text, char c) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * 以逗号连接，最后两项用 and 连接：a, b and c
     */
    public static String joinWithAnd(List<String> items) {
        return joinWith(items, " and ");
    }

    /**
     * 以逗号连接，最后两项用 or 连接：a, b or c
     */
    public static String joinWithOr(List<String> items) {
        return joinWith(items, " or ");
    }

    private static String joinWith(List<String> items, String last) {
        if (items.isEmpty()) return "";
        if (items.size() == 1) return items.get(0);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size() - 1; i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
        sb.append(last).append(items.get(items.size() - 1));
        return sb.toString();
    }

    /** 数量短语：one function / 3 functions / no functions */
    public static String count(int n, String singular, String plural) {
        if (n == 0) return "no " + plural;
        if (n == 1) return "one " + singular;
        return n + " " + plural;
    }
}
