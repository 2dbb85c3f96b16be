package com.c2en.compiler.ast.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型引用
 *
 * <p>由有序的基本说明符、可选的标签（struct/union/enum 名或 typedef 别名）、
 * const 标记和指针层数组成。存储类（static/extern）不属于类型，记录在声明上。</p>
 */
public final class TypeRef {
    private final List<TypeKeyword> keywords;
    private final TagKind tagKind;
    private final String tagName;
    private final boolean constant;
    private final int pointerDepth;

    public TypeRef(List<TypeKeyword> keywords, TagKind tagKind, String tagName,
                   boolean constant, int pointerDepth) {
        this.keywords = Collections.unmodifiableList(new ArrayList<>(keywords));
        this.tagKind = tagKind;
        this.tagName = tagName;
        this.constant = constant;
        this.pointerDepth = pointerDepth;
    }

    /** 单一基本类型，如 int */
    public static TypeRef of(TypeKeyword keyword) {
        return new TypeRef(Collections.singletonList(keyword), TagKind.NONE, null, false, 0);
    }

    public List<TypeKeyword> getKeywords() {
        return keywords;
    }

    public TagKind getTagKind() {
        return tagKind;
    }

    public String getTagName() {
        return tagName;
    }

    public boolean isConst() {
        return constant;
    }

    public int getPointerDepth() {
        return pointerDepth;
    }

    public boolean isPointer() {
        return pointerDepth > 0;
    }

    /** 纯 void（非 void 指针） */
    public boolean isVoid() {
        return pointerDepth == 0 && tagKind == TagKind.NONE
                && keywords.size() == 1 && keywords.get(0) == TypeKeyword.VOID;
    }

    /** 增加一层指针 */
    public TypeRef withPointerDepth(int depth) {
        return new TypeRef(keywords, tagKind, tagName, constant, depth);
    }

    /**
     * C 写法的类型名，如 {@code unsigned int}、{@code const char*}、{@code struct Point*}
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        if (constant) {
            sb.append("const ");
        }
        for (TypeKeyword k : keywords) {
            sb.append(k.getSpelling()).append(' ');
        }
        if (tagKind != TagKind.NONE) {
            if (tagKind.getKeyword() != null) {
                sb.append(tagKind.getKeyword()).append(' ');
            }
            sb.append(tagName != null ? tagName : "(anonymous)").append(' ');
        }
        int end = sb.length();
        if (end > 0 && sb.charAt(end - 1) == ' ') {
            sb.setLength(end - 1);
        }
        for (int i = 0; i < pointerDepth; i++) {
            sb.append('*');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return displayName();
    }

    /**
     * 类型标签种类
     */
    public enum TagKind {
        NONE(null),
        STRUCT("struct"),
        UNION("union"),
        ENUM("enum"),
        /** typedef 别名，书写时不带关键词 */
        ALIAS(null);

        private final String keyword;

        TagKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
