package com.implang.compiler.ast.expr;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

/**
 * 整数字面量
 */
public class Literal extends Expression {
    private final long value;

    public Literal(SourceLocation location, long value) {
        super(location);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
