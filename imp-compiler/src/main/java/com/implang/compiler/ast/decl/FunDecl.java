package com.implang.compiler.ast.decl;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;
import com.implang.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 函数声明
 *
 * <pre>func add(a: int, b: int): int { return a + b }</pre>
 */
public class FunDecl extends Declaration {
    private final Block body;

    public FunDecl(SourceLocation location, String name, List<Parameter> params,
                   String returnType, Block body) {
        super(location, name, params, returnType);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
