package com.c2en.compiler.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * 符号表：显式的作用域帧栈，栈底是全局作用域。
 *
 * <p>进入函数时压入新帧，离开时弹出；查找从栈顶向栈底进行。</p>
 */
public final class SymbolTable {
    private final List<Scope> frames = new ArrayList<>();

    public SymbolTable() {
        frames.add(new Scope(Scope.ScopeType.GLOBAL, "global"));
    }

    public Scope getGlobalScope() {
        return frames.get(0);
    }

    public Scope current() {
        return frames.get(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    public void push(Scope scope) {
        frames.add(scope);
    }

    public void pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        frames.remove(frames.size() - 1);
    }

    /**
     * 在压入的作用域中执行 action，无论如何退出都会弹出该作用域
     */
    public void withScope(Scope scope, Runnable action) {
        push(scope);
        try {
            action.run();
        } finally {
            pop();
        }
    }

    /** 从当前作用域向全局作用域查找 */
    public Symbol resolve(String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Symbol s = frames.get(i).resolveLocal(name);
            if (s != null) return s;
        }
        return null;
    }

    public Symbol resolveGlobal(String name) {
        return getGlobalScope().resolveLocal(name);
    }
}
