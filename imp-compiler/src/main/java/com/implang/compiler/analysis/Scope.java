package com.implang.compiler.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,     // 顶层
        FUNCTION,   // function body
        BLOCK       // { ... } / while body
    }

    private final ScopeType type;
    private final Scope parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    public Scope(ScopeType type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public Scope getParent() { return parent; }

    /** 注册符号到当前作用域 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 是否处于某个函数体内 */
    public boolean isInsideFunction() {
        if (type == ScopeType.FUNCTION) return true;
        return parent != null && parent.isInsideFunction();
    }
}
