package com.c2en.compiler.ast.decl;

import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.SourceLocation;
import com.c2en.compiler.ast.stmt.VarDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（翻译单元根节点）
 *
 * <p>按源码顺序保存外部声明：函数、结构体、枚举、typedef 与全局变量。</p>
 */
public class Program extends AstNode {
    private final List<AstNode> declarations;

    public Program(SourceLocation location, List<AstNode> declarations) {
        super(location);
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public List<AstNode> getDeclarations() {
        return declarations;
    }

    /** 带函数体的函数定义，按声明顺序 */
    public List<FunctionDecl> getFunctionDefinitions() {
        List<FunctionDecl> result = new ArrayList<>();
        for (AstNode decl : declarations) {
            if (decl instanceof FunctionDecl && ((FunctionDecl) decl).isDefinition()) {
                result.add((FunctionDecl) decl);
            }
        }
        return result;
    }

    public List<VarDecl> getGlobalVariables() {
        List<VarDecl> result = new ArrayList<>();
        for (AstNode decl : declarations) {
            if (decl instanceof VarDecl) {
                result.add((VarDecl) decl);
            }
        }
        return result;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
