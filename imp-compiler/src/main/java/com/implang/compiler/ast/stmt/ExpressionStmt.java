package com.implang.compiler.ast.stmt;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.expr.Expression;

/**
 * 表达式语句（结果被丢弃）
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
