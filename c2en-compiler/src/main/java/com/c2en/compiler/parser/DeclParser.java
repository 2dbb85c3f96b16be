package com.c2en.compiler.parser;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.decl.EnumDecl;
import com.c2en.compiler.ast.decl.EnumDecl.EnumConstant;
import com.c2en.compiler.ast.decl.FunctionDecl;
import com.c2en.compiler.ast.decl.Parameter;
import com.c2en.compiler.ast.decl.StructDecl;
import com.c2en.compiler.ast.decl.StructDecl.Field;
import com.c2en.compiler.ast.decl.TypedefDecl;
import com.c2en.compiler.ast.expr.Expression;
import com.c2en.compiler.ast.expr.InitializerList;
import com.c2en.compiler.ast.stmt.Block;
import com.c2en.compiler.ast.stmt.VarDecl;
import com.c2en.compiler.ast.type.TypeRef;
import com.c2en.compiler.lexer.Token;
import com.c2en.compiler.parser.TypeParser.DeclSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.c2en.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：外部声明、typedef、结构体、枚举与变量声明符
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个外部声明。多个声明符的全局变量声明会展开成多个 VarDecl。
     */
    List<AstNode> parseExternalDeclaration() {
        if (parser.check(SEMICOLON)) {
            parser.advance();
            return Collections.emptyList();
        }
        if (parser.check(KW_TYPEDEF)) {
            return parseTypedef();
        }

        SourceLocation loc = parser.location();
        DeclSpec spec = parser.typeParser.parseDeclSpec(true, "Expected return type");

        // struct Point { ... };
        if (spec.definition != null && parser.match(SEMICOLON)) {
            return Collections.singletonList(spec.definition);
        }
        // struct Point; 前向声明
        if (spec.definition == null && spec.type.getTagKind() != TypeRef.TagKind.NONE && parser.match(SEMICOLON)) {
            return Collections.emptyList();
        }

        List<AstNode> result = new ArrayList<>();
        if (spec.definition != null) {
            result.add(spec.definition);
        }

        TypeRef type = parser.typeParser.parsePointers(spec.type);
        Token name = parser.expect(IDENTIFIER, "Expected function name");
        if (parser.check(LPAREN)) {
            result.add(parseFunctionRest(loc, type, name, spec.isStatic));
            return result;
        }

        // 全局变量
        result.addAll(parseDeclaratorsAfterName(spec, type, name, "Expected ';' after declaration"));
        return result;
    }

    // ============ 函数 ============

    private FunctionDecl parseFunctionRest(SourceLocation loc, TypeRef returnType, Token name, boolean isStatic) {
        parser.expect(LPAREN, "Expected '(' after function name");

        List<Parameter> params = new ArrayList<>();
        boolean variadic = false;
        if (parser.check(KW_VOID) && parser.checkAhead(RPAREN)) {
            parser.advance();
        } else if (!parser.check(RPAREN)) {
            do {
                if (parser.match(ELLIPSIS)) {
                    variadic = true;
                    break;
                }
                params.add(parseParameter());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        if (parser.match(SEMICOLON)) {
            return new FunctionDecl(loc, returnType, name.getLexeme(), params, variadic, isStatic, null);
        }

        if (!parser.check(LBRACE)) {
            throw new ParseException("Expected '{' before function body", parser.current);
        }
        for (Parameter p : params) {
            if (p.getName() == null) {
                throw new ParseException("Expected parameter name", parser.current);
            }
        }
        Block body = parser.parseBlock("Expected '{' before function body");
        return new FunctionDecl(loc, returnType, name.getLexeme(), params, variadic, isStatic, body);
    }

    private Parameter parseParameter() {
        SourceLocation loc = parser.location();
        DeclSpec spec = parser.typeParser.parseDeclSpec(false, "Expected parameter type");
        TypeRef type = parser.typeParser.parsePointers(spec.type);

        String name = null;
        if (parser.check(IDENTIFIER)) {
            name = parser.advance().getLexeme();
        }
        boolean array = false;
        if (parser.match(LBRACKET)) {
            // int a[] 或 int a[10]，长度对参数没有意义
            if (!parser.check(RBRACKET)) {
                parser.parseConditional();
            }
            parser.expect(RBRACKET, "Expected ']' after '['");
            array = true;
        }
        return new Parameter(loc, type, name, array);
    }

    // ============ typedef / struct / enum ============

    private List<AstNode> parseTypedef() {
        SourceLocation loc = parser.location();
        parser.expect(KW_TYPEDEF, "Expected 'typedef'");
        DeclSpec spec = parser.typeParser.parseDeclSpec(true, "Expected type after 'typedef'");
        TypeRef target = parser.typeParser.parsePointers(spec.type);
        Token alias = parser.expect(IDENTIFIER, "Expected type name");
        parser.expect(SEMICOLON, "Expected ';' after typedef");
        parser.registerTypedefName(alias.getLexeme());

        AstNode definition = spec.definition;
        if (definition instanceof StructDecl && ((StructDecl) definition).getName() == null) {
            // typedef struct { ... } Point; 以别名命名匿名结构体
            StructDecl anonymous = (StructDecl) definition;
            definition = new StructDecl(anonymous.getLocation(), anonymous.isUnion(),
                    alias.getLexeme(), anonymous.getFields());
            target = new TypeRef(target.getKeywords(), target.getTagKind(), alias.getLexeme(),
                    target.isConst(), target.getPointerDepth());
        } else if (definition instanceof EnumDecl && ((EnumDecl) definition).getName() == null) {
            EnumDecl anonymous = (EnumDecl) definition;
            definition = new EnumDecl(anonymous.getLocation(), alias.getLexeme(), anonymous.getConstants());
            target = new TypeRef(target.getKeywords(), target.getTagKind(), alias.getLexeme(),
                    target.isConst(), target.getPointerDepth());
        }
        return Collections.singletonList(new TypedefDecl(loc, target, alias.getLexeme(), definition));
    }

    /**
     * 解析 {@code { int x; int y; }}，当前位于左花括号
     */
    StructDecl parseStructBody(Token keyword, String name) {
        SourceLocation loc = parser.locationOf(keyword);
        parser.expect(LBRACE, "Expected '{' after " + keyword.getLexeme() + " name");
        List<Field> fields = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            DeclSpec spec = parser.typeParser.parseDeclSpec(false, "Expected member type");
            do {
                TypeRef type = parser.typeParser.parsePointers(spec.type);
                String fieldName = parser.expect(IDENTIFIER, "Expected member name").getLexeme();
                String size = null;
                if (parser.match(LBRACKET)) {
                    size = parser.check(NUMBER) || parser.check(IDENTIFIER) ? parser.advance().getLexeme() : "";
                    parser.expect(RBRACKET, "Expected ']' after array size");
                }
                fields.add(new Field(type, fieldName, size));
            } while (parser.match(COMMA));
            parser.expect(SEMICOLON, "Expected ';' after member declaration");
        }
        parser.expect(RBRACE, "Expected '}' after " + keyword.getLexeme() + " body");
        return new StructDecl(loc, keyword.is(KW_UNION), name, fields);
    }

    /**
     * 解析 {@code { RED, GREEN = 2 }}，当前位于左花括号
     */
    EnumDecl parseEnumBody(Token keyword, String name) {
        SourceLocation loc = parser.locationOf(keyword);
        parser.expect(LBRACE, "Expected '{' after enum name");
        List<EnumConstant> constants = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Token constant = parser.expect(IDENTIFIER, "Expected enumerator name");
            Expression value = null;
            if (parser.match(ASSIGN)) {
                value = parser.parseConditional();
            }
            constants.add(new EnumConstant(parser.locationOf(constant), constant.getLexeme(), value));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after enum body");
        return new EnumDecl(loc, name, constants);
    }

    // ============ 变量声明符 ============

    /**
     * 解析局部声明 {@code int a, *b, c[10] = {...};}，当前位于类型起始处
     *
     * @param terminatorMessage 缺少结尾分号时的错误信息
     */
    List<VarDecl> parseLocalDeclaration(String terminatorMessage) {
        DeclSpec spec = parser.typeParser.parseDeclSpec(false, "Expected type");
        TypeRef type = parser.typeParser.parsePointers(spec.type);
        Token name = parser.expect(IDENTIFIER, "Expected variable name");
        return parseDeclaratorsAfterName(spec, type, name, terminatorMessage);
    }

    private List<VarDecl> parseDeclaratorsAfterName(DeclSpec spec, TypeRef firstType, Token firstName,
                                                    String terminatorMessage) {
        List<VarDecl> result = new ArrayList<>();
        result.add(parseDeclaratorRest(spec, firstType, firstName));
        while (parser.match(COMMA)) {
            TypeRef type = parser.typeParser.parsePointers(spec.type);
            Token name = parser.expect(IDENTIFIER, "Expected variable name");
            result.add(parseDeclaratorRest(spec, type, name));
        }
        parser.expect(SEMICOLON, terminatorMessage);
        return result;
    }

    private VarDecl parseDeclaratorRest(DeclSpec spec, TypeRef type, Token name) {
        boolean array = false;
        Expression size = null;
        if (parser.match(LBRACKET)) {
            array = true;
            if (!parser.check(RBRACKET)) {
                size = parser.parseExpression();
            }
            parser.expect(RBRACKET, "Expected ']' after array size");
        }
        Expression initializer = null;
        if (parser.match(ASSIGN)) {
            initializer = parser.check(LBRACE) ? parseInitializerList() : parser.parseAssignment();
        }
        return new VarDecl(parser.locationOf(name), type, name.getLexeme(), array, size,
                initializer, spec.isStatic);
    }

    private InitializerList parseInitializerList() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        parser.enterNesting(ExprParser.TOO_DEEP);
        try {
            List<Expression> elements = new ArrayList<>();
            while (!parser.check(RBRACE) && !parser.isAtEnd()) {
                elements.add(parser.check(LBRACE) ? parseInitializerList() : parser.parseAssignment());
                if (!parser.match(COMMA)) {
                    break;
                }
            }
            parser.expect(RBRACE, "Expected '}' after initialiser list");
            return new InitializerList(loc, elements);
        } finally {
            parser.exitNesting();
        }
    }
}
