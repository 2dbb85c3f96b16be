package com.c2en.compiler.json;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.decl.*;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.stmt.*;
import com.c2en.compiler.lexer.Token;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 把 AST 与 Token 流转换为 JSON，供调试输出使用
 */
public class AstJsonWriter implements AstVisitor<JsonElement, Void> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /** 语法树的 JSON 文本 */
    public String toJson(Program program) {
        return gson.toJson(program.accept(this, null));
    }

    /** Token 流的 JSON 文本 */
    public String toJson(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            JsonObject obj = new JsonObject();
            obj.addProperty("type", token.getType().name());
            obj.addProperty("lexeme", token.getLexeme());
            obj.addProperty("line", token.getLine());
            obj.addProperty("column", token.getColumn());
            array.add(obj);
        }
        return gson.toJson(array);
    }

    // ============ 辅助方法 ============

    private JsonObject node(String kind, AstNode node) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kind);
        if (node.getLocation() != null) {
            obj.addProperty("line", node.getLocation().getLine());
            obj.addProperty("column", node.getLocation().getColumn());
        }
        return obj;
    }

    private JsonElement child(AstNode node) {
        return node != null ? node.accept(this, null) : JsonNull.INSTANCE;
    }

    private JsonArray children(List<? extends AstNode> nodes) {
        JsonArray array = new JsonArray();
        for (AstNode n : nodes) {
            array.add(child(n));
        }
        return array;
    }

    // ============ 声明 ============

    @Override
    public JsonElement visitProgram(Program node, Void ctx) {
        JsonObject obj = node("Program", node);
        obj.add("declarations", children(node.getDeclarations()));
        return obj;
    }

    @Override
    public JsonElement visitFunctionDecl(FunctionDecl node, Void ctx) {
        JsonObject obj = node("FunctionDecl", node);
        obj.addProperty("name", node.getName());
        obj.addProperty("returnType", node.getReturnType().displayName());
        JsonArray params = new JsonArray();
        for (Parameter p : node.getParams()) {
            JsonObject param = new JsonObject();
            param.addProperty("name", p.getName());
            param.addProperty("type", p.getType().displayName());
            param.addProperty("array", p.isArray());
            params.add(param);
        }
        obj.add("params", params);
        obj.addProperty("variadic", node.isVariadic());
        obj.addProperty("static", node.isStatic());
        obj.add("body", child(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitStructDecl(StructDecl node, Void ctx) {
        JsonObject obj = node(node.isUnion() ? "UnionDecl" : "StructDecl", node);
        obj.addProperty("name", node.getName());
        JsonArray fields = new JsonArray();
        for (StructDecl.Field f : node.getFields()) {
            JsonObject field = new JsonObject();
            field.addProperty("name", f.getName());
            field.addProperty("type", f.getType().displayName());
            field.addProperty("arraySize", f.getArraySize());
            fields.add(field);
        }
        obj.add("fields", fields);
        return obj;
    }

    @Override
    public JsonElement visitEnumDecl(EnumDecl node, Void ctx) {
        JsonObject obj = node("EnumDecl", node);
        obj.addProperty("name", node.getName());
        JsonArray constants = new JsonArray();
        for (EnumDecl.EnumConstant c : node.getConstants()) {
            JsonObject constant = new JsonObject();
            constant.addProperty("name", c.getName());
            constant.add("value", child(c.getValue()));
            constants.add(constant);
        }
        obj.add("constants", constants);
        return obj;
    }

    @Override
    public JsonElement visitTypedefDecl(TypedefDecl node, Void ctx) {
        JsonObject obj = node("TypedefDecl", node);
        obj.addProperty("alias", node.getAlias());
        obj.addProperty("target", node.getTarget().displayName());
        obj.add("definition", child(node.getDefinition()));
        return obj;
    }

    // ============ 语句 ============

    @Override
    public JsonElement visitBlock(Block node, Void ctx) {
        JsonObject obj = node("Block", node);
        obj.add("statements", children(node.getStatements()));
        return obj;
    }

    @Override
    public JsonElement visitVarDecl(VarDecl node, Void ctx) {
        JsonObject obj = node("VarDecl", node);
        obj.addProperty("name", node.getName());
        obj.addProperty("type", node.getType().displayName());
        obj.addProperty("array", node.isArray());
        obj.addProperty("static", node.isStatic());
        obj.add("arraySize", child(node.getArraySize()));
        obj.add("initializer", child(node.getInitializer()));
        return obj;
    }

    @Override
    public JsonElement visitIfStmt(IfStmt node, Void ctx) {
        JsonObject obj = node("IfStmt", node);
        obj.add("condition", child(node.getCondition()));
        obj.add("then", child(node.getThenBranch()));
        obj.add("else", child(node.getElseBranch()));
        return obj;
    }

    @Override
    public JsonElement visitWhileStmt(WhileStmt node, Void ctx) {
        JsonObject obj = node("WhileStmt", node);
        obj.add("condition", child(node.getCondition()));
        obj.add("body", child(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitDoWhileStmt(DoWhileStmt node, Void ctx) {
        JsonObject obj = node("DoWhileStmt", node);
        obj.add("body", child(node.getBody()));
        obj.add("condition", child(node.getCondition()));
        return obj;
    }

    @Override
    public JsonElement visitForStmt(ForStmt node, Void ctx) {
        JsonObject obj = node("ForStmt", node);
        obj.add("init", child(node.getInit()));
        obj.add("condition", child(node.getCondition()));
        obj.add("update", child(node.getUpdate()));
        obj.add("body", child(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitSwitchStmt(SwitchStmt node, Void ctx) {
        JsonObject obj = node("SwitchStmt", node);
        obj.add("subject", child(node.getSubject()));
        obj.add("clauses", children(node.getClauses()));
        return obj;
    }

    @Override
    public JsonElement visitCaseClause(CaseClause node, Void ctx) {
        JsonObject obj = node(node.isDefault() ? "DefaultClause" : "CaseClause", node);
        obj.add("value", child(node.getValue()));
        obj.add("body", children(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitReturnStmt(ReturnStmt node, Void ctx) {
        JsonObject obj = node("ReturnStmt", node);
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonElement visitBreakStmt(BreakStmt node, Void ctx) {
        return node("BreakStmt", node);
    }

    @Override
    public JsonElement visitContinueStmt(ContinueStmt node, Void ctx) {
        return node("ContinueStmt", node);
    }

    @Override
    public JsonElement visitGotoStmt(GotoStmt node, Void ctx) {
        JsonObject obj = node("GotoStmt", node);
        obj.addProperty("label", node.getLabel());
        return obj;
    }

    @Override
    public JsonElement visitLabeledStmt(LabeledStmt node, Void ctx) {
        JsonObject obj = node("LabeledStmt", node);
        obj.addProperty("label", node.getLabel());
        obj.add("statement", child(node.getStatement()));
        return obj;
    }

    @Override
    public JsonElement visitExpressionStmt(ExpressionStmt node, Void ctx) {
        JsonObject obj = node("ExpressionStmt", node);
        obj.add("expression", child(node.getExpression()));
        return obj;
    }

    // ============ 表达式 ============

    @Override
    public JsonElement visitBinaryExpr(BinaryExpr node, Void ctx) {
        JsonObject obj = node("BinaryExpr", node);
        obj.addProperty("operator", node.getOperator().name());
        obj.add("left", child(node.getLeft()));
        obj.add("right", child(node.getRight()));
        return obj;
    }

    @Override
    public JsonElement visitUnaryExpr(UnaryExpr node, Void ctx) {
        JsonObject obj = node("UnaryExpr", node);
        obj.addProperty("operator", node.getOperator().name());
        obj.add("operand", child(node.getOperand()));
        return obj;
    }

    @Override
    public JsonElement visitCallExpr(CallExpr node, Void ctx) {
        JsonObject obj = node("CallExpr", node);
        obj.addProperty("callee", node.getCallee());
        obj.add("args", children(node.getArgs()));
        return obj;
    }

    @Override
    public JsonElement visitIndexExpr(IndexExpr node, Void ctx) {
        JsonObject obj = node("IndexExpr", node);
        obj.add("target", child(node.getTarget()));
        obj.add("index", child(node.getIndex()));
        return obj;
    }

    @Override
    public JsonElement visitAssignExpr(AssignExpr node, Void ctx) {
        JsonObject obj = node("AssignExpr", node);
        obj.addProperty("operator", node.getOperator().name());
        obj.add("target", child(node.getTarget()));
        obj.add("value", child(node.getValue()));
        return obj;
    }

    @Override
    public JsonElement visitLiteral(Literal node, Void ctx) {
        JsonObject obj = node("Literal", node);
        obj.addProperty("literalKind", node.getKind().name());
        obj.addProperty("text", node.getText());
        return obj;
    }

    @Override
    public JsonElement visitIdentifier(Identifier node, Void ctx) {
        JsonObject obj = node("Identifier", node);
        obj.addProperty("name", node.getName());
        return obj;
    }

    @Override
    public JsonElement visitMemberExpr(MemberExpr node, Void ctx) {
        JsonObject obj = node("MemberExpr", node);
        obj.add("target", child(node.getTarget()));
        obj.addProperty("member", node.getMember());
        obj.addProperty("arrow", node.isArrow());
        return obj;
    }

    @Override
    public JsonElement visitConditionalExpr(ConditionalExpr node, Void ctx) {
        JsonObject obj = node("ConditionalExpr", node);
        obj.add("condition", child(node.getCondition()));
        obj.add("then", child(node.getThenExpr()));
        obj.add("else", child(node.getElseExpr()));
        return obj;
    }

    @Override
    public JsonElement visitSizeofExpr(SizeofExpr node, Void ctx) {
        JsonObject obj = node("SizeofExpr", node);
        if (node.isTypeOperand()) {
            obj.addProperty("type", node.getTargetType().displayName());
        } else {
            obj.add("operand", child(node.getOperand()));
        }
        return obj;
    }

    @Override
    public JsonElement visitCastExpr(CastExpr node, Void ctx) {
        JsonObject obj = node("CastExpr", node);
        obj.addProperty("type", node.getTargetType().displayName());
        obj.add("operand", child(node.getOperand()));
        return obj;
    }

    @Override
    public JsonElement visitInitializerList(InitializerList node, Void ctx) {
        JsonObject obj = node("InitializerList", node);
        obj.add("elements", children(node.getElements()));
        return obj;
    }
}
