package com.implang.compiler.ast.stmt;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 代码块
 */
public class Block extends Statement {
    private final List<Statement> statements;

    public Block(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
