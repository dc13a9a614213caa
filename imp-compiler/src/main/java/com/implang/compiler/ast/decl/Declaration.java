package com.implang.compiler.ast.decl;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数声明与外部原型声明的公共基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;
    protected final List<Parameter> params;
    protected final String returnType;

    protected Declaration(SourceLocation location, String name, List<Parameter> params, String returnType) {
        super(location);
        this.name = name;
        this.params = params;
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    public String getReturnType() {
        return returnType;
    }
}
