package com.implang.compiler.codegen;

import com.implang.compiler.ast.SourceLocation;
import imp.runtime.ImpException;

/**
 * 代码生成失败（面向用户的错误，例如原型绑定的原语不存在）
 */
public class CodegenException extends ImpException {
    private final SourceLocation location;

    public CodegenException(String message, SourceLocation location) {
        super(location != null ? location + ": " + message : message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
