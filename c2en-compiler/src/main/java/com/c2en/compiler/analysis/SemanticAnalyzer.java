package com.c2en.compiler.analysis;

import com.c2en.compiler.StandardLibrary;
import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.decl.*;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.stmt.*;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 语义分析器：遍历 AST 维护作用域栈并收集诊断。
 *
 * <p>全局作用域保存函数、全局变量、枚举常量、typedef 名和预定义常量；
 * 每个函数一个扁平作用域，参数与所有局部变量（包括嵌套块中的）共享。
 * 分析不会提前结束，整棵树走完后才根据诊断数量判断成败。
 * 具体检查委托给 {@link SemanticChecker}。</p>
 */
public final class SemanticAnalyzer implements AstVisitor<Void, Void> {
    private static final Logger LOG = Logger.getLogger(SemanticAnalyzer.class.getName());

    private final SymbolTable symbolTable = new SymbolTable();
    private final List<SemanticDiagnostic> diagnostics = new ArrayList<>();
    private final SemanticChecker checker;

    public SemanticAnalyzer() {
        this(System.err);
    }

    public SemanticAnalyzer(PrintStream errStream) {
        this.checker = new SemanticChecker(diagnostics, errStream);
        registerBuiltins();
    }

    /** 分析入口 */
    public AnalysisResult analyze(Program program) {
        program.accept(this, null);
        LOG.fine(() -> "Semantic analysis finished with " + diagnostics.size() + " diagnostics");
        return new AnalysisResult(symbolTable, diagnostics);
    }

    // ============ 内置符号注册 ============

    private void registerBuiltins() {
        Scope global = symbolTable.getGlobalScope();
        for (String name : StandardLibrary.constantNames()) {
            global.define(new Symbol(name, SymbolKind.BUILTIN_CONSTANT, "int", global.getName(), null, false));
        }
    }

    // ============ 辅助方法 ============

    private void visit(AstNode node) {
        if (node != null) {
            node.accept(this, null);
        }
    }

    private void visitAll(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            visit(node);
        }
    }

    private void defineVariable(String name, SymbolKind kind, String typeName, boolean array,
                                SourceLocation location) {
        Scope scope = symbolTable.current();
        if (checker.checkRedefinition(scope, name, location)) {
            scope.define(new Symbol(name, kind, typeName, scope.getName(), location, array));
        }
    }

    /**
     * 预先登记所有函数，使函数可以调用在其后定义的函数。
     * 原型之后的定义不算重复；两个定义才报告。
     */
    private void registerFunction(FunctionDecl node) {
        Scope global = symbolTable.getGlobalScope();
        Symbol existing = global.resolveLocal(node.getName());
        if (existing != null) {
            boolean duplicate = !existing.isFunction() || (existing.isDefined() && node.isDefinition());
            if (duplicate) {
                checker.report(SemanticDiagnostic.Kind.DUPLICATE_FUNCTION, node.getName(),
                        "Function '" + node.getName() + "' already declared", node.getLocation());
            } else if (node.isDefinition()) {
                existing.setDefined(true);
            }
            return;
        }
        Symbol symbol = new Symbol(node.getName(), SymbolKind.FUNCTION,
                node.getReturnType().displayName(), global.getName(), node.getLocation(), false);
        symbol.setDefined(node.isDefinition());
        global.define(symbol);
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, Void ctx) {
        for (AstNode decl : node.getDeclarations()) {
            if (decl instanceof FunctionDecl) {
                registerFunction((FunctionDecl) decl);
            }
        }
        visitAll(node.getDeclarations());
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, Void ctx) {
        if (!node.isDefinition()) {
            return null;
        }
        symbolTable.withScope(new Scope(Scope.ScopeType.FUNCTION, node.getName()), () -> {
            for (Parameter param : node.getParams()) {
                defineVariable(param.getName(), SymbolKind.PARAMETER, param.getType().displayName(),
                        param.isArray(), param.getLocation());
            }
            visitAll(node.getBody().getStatements());
        });
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, Void ctx) {
        // 结构体标签和成员不进入普通标识符命名空间
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, Void ctx) {
        Scope scope = symbolTable.current();
        for (EnumDecl.EnumConstant constant : node.getConstants()) {
            visit(constant.getValue());
            if (checker.checkRedefinition(scope, constant.getName(), constant.getLocation())) {
                String typeName = node.getName() != null ? "enum " + node.getName() : "int";
                scope.define(new Symbol(constant.getName(), SymbolKind.ENUM_CONSTANT, typeName,
                        scope.getName(), constant.getLocation(), false));
            }
        }
        return null;
    }

    @Override
    public Void visitTypedefDecl(TypedefDecl node, Void ctx) {
        visit(node.getDefinition());
        defineVariable(node.getAlias(), SymbolKind.TYPE_ALIAS, node.getTarget().displayName(), false,
                node.getLocation());
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, Void ctx) {
        visitAll(node.getStatements());
        return null;
    }

    @Override
    public Void visitVarDecl(VarDecl node, Void ctx) {
        defineVariable(node.getName(), SymbolKind.VARIABLE, node.getType().displayName(), node.isArray(),
                node.getLocation());
        visit(node.getArraySize());
        visit(node.getInitializer());
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        visit(node.getCondition());
        visit(node.getThenBranch());
        visit(node.getElseBranch());
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        visit(node.getCondition());
        visit(node.getBody());
        return null;
    }

    @Override
    public Void visitDoWhileStmt(DoWhileStmt node, Void ctx) {
        visit(node.getBody());
        visit(node.getCondition());
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        visit(node.getInit());
        visit(node.getCondition());
        visit(node.getUpdate());
        visit(node.getBody());
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node, Void ctx) {
        visit(node.getSubject());
        visitAll(node.getClauses());
        return null;
    }

    @Override
    public Void visitCaseClause(CaseClause node, Void ctx) {
        visit(node.getValue());
        visitAll(node.getBody());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        visit(node.getValue());
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitGotoStmt(GotoStmt node, Void ctx) {
        return null;
    }

    @Override
    public Void visitLabeledStmt(LabeledStmt node, Void ctx) {
        visit(node.getStatement());
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        visit(node.getExpression());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        visit(node.getLeft());
        visit(node.getRight());
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        visit(node.getOperand());
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        checker.checkCall(symbolTable, node);
        visitAll(node.getArgs());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, Void ctx) {
        if (node.getTarget() instanceof Identifier) {
            checker.checkIndexTarget(symbolTable, (Identifier) node.getTarget());
        } else {
            visit(node.getTarget());
        }
        visit(node.getIndex());
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, Void ctx) {
        visit(node.getTarget());
        visit(node.getValue());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        checker.checkIdentifier(symbolTable, node);
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        visit(node.getTarget());
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, Void ctx) {
        visit(node.getCondition());
        visit(node.getThenExpr());
        visit(node.getElseExpr());
        return null;
    }

    @Override
    public Void visitSizeofExpr(SizeofExpr node, Void ctx) {
        visit(node.getOperand());
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, Void ctx) {
        visit(node.getOperand());
        return null;
    }

    @Override
    public Void visitInitializerList(InitializerList node, Void ctx) {
        visitAll(node.getElements());
        return null;
    }
}
