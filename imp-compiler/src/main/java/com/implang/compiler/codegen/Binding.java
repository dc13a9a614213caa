package com.implang.compiler.codegen;

import imp.runtime.NativePrimitive;

/**
 * 名称绑定：作用域查找的结果
 */
public final class Binding {

    public enum Kind {
        FUNCTION,   // 函数入口标签
        NATIVE,     // 原生原语
        ARGUMENT    // 参数槽位
    }

    private final Kind kind;
    private final Label entry;
    private final NativePrimitive primitive;
    private final int slot;

    private Binding(Kind kind, Label entry, NativePrimitive primitive, int slot) {
        this.kind = kind;
        this.entry = entry;
        this.primitive = primitive;
        this.slot = slot;
    }

    public static Binding function(Label entry) {
        return new Binding(Kind.FUNCTION, entry, null, -1);
    }

    public static Binding nativePrimitive(NativePrimitive primitive) {
        return new Binding(Kind.NATIVE, null, primitive, -1);
    }

    public static Binding argument(int slot) {
        return new Binding(Kind.ARGUMENT, null, null, slot);
    }

    public Kind getKind() {
        return kind;
    }

    public Label getEntry() {
        checkKind(Kind.FUNCTION);
        return entry;
    }

    public NativePrimitive getPrimitive() {
        checkKind(Kind.NATIVE);
        return primitive;
    }

    public int getSlot() {
        checkKind(Kind.ARGUMENT);
        return slot;
    }

    private void checkKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Binding is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case FUNCTION: return "function " + entry;
            case NATIVE: return "native " + primitive.getName();
            case ARGUMENT: return "argument #" + slot;
            default: throw new AssertionError(kind);
        }
    }
}
