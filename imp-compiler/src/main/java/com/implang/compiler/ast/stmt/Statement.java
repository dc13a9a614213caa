package com.implang.compiler.ast.stmt;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
