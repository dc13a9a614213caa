package com.implang.compiler.ast;

/**
 * 节点在源码中的起始位置（行列从 1 开始）
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 诊断前缀格式 {@code file:line:col} */
    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
