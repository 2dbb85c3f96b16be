package com.c2en.compiler.analysis;

import com.c2en.compiler.StandardLibrary;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.expr.CallExpr;
import com.c2en.compiler.ast.expr.Identifier;

import java.io.PrintStream;
import java.util.List;

/**
 * 语义验证：所有语义检查和诊断报告。
 * 每条诊断在记录的同时写到错误流。
 */
public final class SemanticChecker {

    private final List<SemanticDiagnostic> diagnostics;
    private final PrintStream errStream;

    public SemanticChecker(List<SemanticDiagnostic> diagnostics, PrintStream errStream) {
        this.diagnostics = diagnostics;
        this.errStream = errStream;
    }

    /** 报告诊断 */
    public void report(SemanticDiagnostic.Kind kind, String name, String message, SourceLocation location) {
        SemanticDiagnostic diagnostic = new SemanticDiagnostic(kind, name, message, location);
        diagnostics.add(diagnostic);
        errStream.println(diagnostic.format());
    }

    /**
     * 检查当前作用域是否已有同名符号，若有则报错
     *
     * @return 没有冲突时返回 true
     */
    public boolean checkRedefinition(Scope scope, String name, SourceLocation location) {
        if (scope.resolveLocal(name) == null) {
            return true;
        }
        report(SemanticDiagnostic.Kind.DUPLICATE_DECLARATION, name,
                "Variable '" + name + "' already declared in this scope", location);
        return false;
    }

    /** 标识符引用必须能在作用域链中找到 */
    public void checkIdentifier(SymbolTable table, Identifier node) {
        if (table.resolve(node.getName()) == null) {
            report(SemanticDiagnostic.Kind.UNDECLARED_IDENTIFIER, node.getName(),
                    "Undeclared variable '" + node.getName() + "'", node.getLocation());
        }
    }

    /** 被调用的函数必须在全局作用域中声明，或是已知的标准库函数 */
    public void checkCall(SymbolTable table, CallExpr node) {
        String name = node.getCallee();
        Symbol symbol = table.resolveGlobal(name);
        if (symbol != null && symbol.isFunction()) {
            return;
        }
        if (StandardLibrary.isKnownFunction(name)) {
            return;
        }
        report(SemanticDiagnostic.Kind.UNDEFINED_FUNCTION, name,
                "Undefined function '" + name + "'", node.getLocation());
    }

    /** 下标访问的名字必须已声明且是数组（或指针） */
    public void checkIndexTarget(SymbolTable table, Identifier node) {
        Symbol symbol = table.resolve(node.getName());
        if (symbol == null) {
            report(SemanticDiagnostic.Kind.UNDECLARED_ARRAY, node.getName(),
                    "Undeclared array '" + node.getName() + "'", node.getLocation());
        } else if (!symbol.isIndexable()) {
            report(SemanticDiagnostic.Kind.NOT_AN_ARRAY, node.getName(),
                    "'" + node.getName() + "' is not an array", node.getLocation());
        }
    }
}
