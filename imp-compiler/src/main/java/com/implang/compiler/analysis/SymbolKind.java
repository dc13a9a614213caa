package com.implang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    FUNCTION,           // func 声明
    PROTOTYPE,          // 绑定原生原语的 func 声明
    PARAMETER           // 函数参数
}
