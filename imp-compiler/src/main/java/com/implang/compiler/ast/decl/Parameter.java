package com.implang.compiler.ast.decl;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

/**
 * 函数参数（名称 + 类型名）
 */
public class Parameter extends AstNode {
    private final String name;
    private final String typeName;

    public Parameter(SourceLocation location, String name, String typeName) {
        super(location);
        this.name = name;
        this.typeName = typeName;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
