package com.implang.compiler.ast.expr;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

/**
 * 标识符表达式（对函数、原型或参数的引用）
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
