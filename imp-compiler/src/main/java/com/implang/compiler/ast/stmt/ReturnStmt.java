package com.implang.compiler.ast.stmt;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.expr.Expression;

/**
 * Return 语句
 */
public class ReturnStmt extends Statement {
    private final Expression value;

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
