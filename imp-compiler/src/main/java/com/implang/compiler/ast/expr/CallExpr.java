package com.implang.compiler.ast.expr;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
