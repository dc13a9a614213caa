package com.implang.compiler.analysis;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.SourceLocation;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final int arity;              // 函数/原型的参数个数，参数符号为 -1
    private final SourceLocation location;// 声明位置
    private final AstNode declaration;    // 声明的 AST 节点

    public Symbol(String name, SymbolKind kind, int arity, SourceLocation location, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.arity = arity;
        this.location = location;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public int getArity() { return arity; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }

    public boolean isCallable() {
        return kind == SymbolKind.FUNCTION || kind == SymbolKind.PROTOTYPE;
    }
}
