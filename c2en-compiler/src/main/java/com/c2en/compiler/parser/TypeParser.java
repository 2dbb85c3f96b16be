package com.c2en.compiler.parser;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.type.TypeKeyword;
import com.c2en.compiler.ast.type.TypeRef;
import com.c2en.compiler.ast.type.TypeRef.TagKind;
import com.c2en.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.c2en.compiler.lexer.TokenType.*;

/**
 * 类型解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析完整类型（说明符 + 指针），用于参数、转换与 sizeof。
     * 不允许内联的 struct/enum 定义。
     */
    TypeRef parseType() {
        DeclSpec spec = parseDeclSpec(false, "Expected type");
        return parsePointers(spec.type);
    }

    /**
     * 解析声明说明符：存储类、const、基本类型关键词、struct/union/enum 标签或 typedef 名。
     *
     * @param allowDefinition 是否允许 {@code struct Name { ... }} 这样的内联定义
     * @param message         当前位置不是类型时的错误信息
     */
    DeclSpec parseDeclSpec(boolean allowDefinition, String message) {
        List<TypeKeyword> keywords = new ArrayList<>();
        TagKind tagKind = TagKind.NONE;
        String tagName = null;
        boolean constant = false;
        boolean isStatic = false;
        AstNode definition = null;
        Token first = parser.current;

        while (true) {
            if (parser.match(KW_CONST)) {
                constant = true;
            } else if (parser.match(KW_STATIC)) {
                isStatic = true;
            } else if (parser.match(KW_EXTERN)) {
                // extern 只影响链接，不影响描述
            } else if (TypeKeyword.fromToken(parser.current.getType()) != null) {
                keywords.add(TypeKeyword.fromToken(parser.advance().getType()));
            } else if (tagKind == TagKind.NONE && keywords.isEmpty()
                    && parser.checkAny(KW_STRUCT, KW_UNION, KW_ENUM)) {
                Token keyword = parser.advance();
                tagKind = keyword.is(KW_STRUCT) ? TagKind.STRUCT
                        : keyword.is(KW_UNION) ? TagKind.UNION : TagKind.ENUM;
                if (parser.check(IDENTIFIER)) {
                    tagName = parser.advance().getLexeme();
                }
                if (parser.check(LBRACE)) {
                    if (!allowDefinition) {
                        throw new ParseException("Type definitions are only allowed at file scope", parser.current);
                    }
                    definition = tagKind == TagKind.ENUM
                            ? parser.declParser.parseEnumBody(keyword, tagName)
                            : parser.declParser.parseStructBody(keyword, tagName);
                } else if (tagName == null) {
                    throw new ParseException("Expected " + keyword.getLexeme() + " name", parser.current);
                }
            } else if (tagKind == TagKind.NONE && keywords.isEmpty() && parser.isTypedefName(parser.current)) {
                tagKind = TagKind.ALIAS;
                tagName = parser.advance().getLexeme();
            } else {
                break;
            }
        }

        if (keywords.isEmpty() && tagKind == TagKind.NONE) {
            throw new ParseException(message, first);
        }
        return new DeclSpec(new TypeRef(keywords, tagKind, tagName, constant, 0), isStatic, definition);
    }

    /**
     * 解析类型后的 {@code *}（指针后的 const 被接受并忽略）
     */
    TypeRef parsePointers(TypeRef base) {
        int depth = 0;
        while (parser.match(STAR)) {
            depth++;
            while (parser.match(KW_CONST)) {
                // char * const p
            }
        }
        return depth == 0 ? base : base.withPointerDepth(base.getPointerDepth() + depth);
    }

    /**
     * 声明说明符解析结果
     */
    static final class DeclSpec {
        final TypeRef type;
        final boolean isStatic;
        /** 内联的 struct/union/enum 定义，没有则为 null */
        final AstNode definition;

        DeclSpec(TypeRef type, boolean isStatic, AstNode definition) {
            this.type = type;
            this.isStatic = isStatic;
            this.definition = definition;
        }
    }
}
