package com.implang.compiler.codegen;

/**
 * 代码标签：地址未知时的占位标识，由 {@link LabelTable} 分配与放置
 */
public final class Label {
    private final int id;

    Label(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Label)) return false;
        return id == ((Label) o).id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "L" + id;
    }
}
