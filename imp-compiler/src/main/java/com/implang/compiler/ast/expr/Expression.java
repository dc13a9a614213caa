package com.implang.compiler.ast.expr;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
