package com.implang.compiler.ast.expr;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {

    /** 二元运算符 */
    public enum BinaryOp {
        ADD("+");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }
}
