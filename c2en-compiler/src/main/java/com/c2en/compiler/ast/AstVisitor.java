package com.c2en.compiler.ast;

import com.c2en.compiler.ast.decl.*;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点一个抽象方法，没有默认实现：新增节点类型时，
 * 所有访问者（检查器、翻译器、AST 导出）都必须补上对应分支才能编译。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitStructDecl(StructDecl node, C ctx);

    R visitEnumDecl(EnumDecl node, C ctx);

    R visitTypedefDecl(TypedefDecl node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitVarDecl(VarDecl node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitDoWhileStmt(DoWhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitSwitchStmt(SwitchStmt node, C ctx);

    R visitCaseClause(CaseClause node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitGotoStmt(GotoStmt node, C ctx);

    R visitLabeledStmt(LabeledStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    // ============ 表达式 ============

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitAssignExpr(AssignExpr node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitConditionalExpr(ConditionalExpr node, C ctx);

    R visitSizeofExpr(SizeofExpr node, C ctx);

    R visitCastExpr(CastExpr node, C ctx);

    R visitInitializerList(InitializerList node, C ctx);
}
