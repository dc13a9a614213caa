package com.implang.compiler.ast.decl;

import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 外部原型声明，绑定到宿主提供的原生原语
 *
 * <pre>func print(a: int): int = "print_int"</pre>
 */
public class ProtoDecl extends Declaration {
    private final String primitiveName;

    public ProtoDecl(SourceLocation location, String name, List<Parameter> params,
                     String returnType, String primitiveName) {
        super(location, name, params, returnType);
        this.primitiveName = primitiveName;
    }

    public String getPrimitiveName() {
        return primitiveName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProtoDecl(this, context);
    }
}
