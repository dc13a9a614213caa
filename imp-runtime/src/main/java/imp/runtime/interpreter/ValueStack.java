package imp.runtime.interpreter;

import imp.runtime.OperandStack;
import imp.runtime.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 虚拟机操作数栈
 *
 * <p>数组实现，按需扩容；超过 {@code maxDepth}（0 为不限）时抛出栈溢出。</p>
 */
public final class ValueStack implements OperandStack {

    private Value[] values = new Value[32];
    private int size;
    private final int maxDepth;

    public ValueStack(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public ValueStack() {
        this(0);
    }

    @Override
    public void push(Value value) {
        if (maxDepth > 0 && size >= maxDepth) {
            throw new ImpRuntimeException("Stack overflow: depth limit " + maxDepth + " exceeded");
        }
        if (size == values.length) {
            values = Arrays.copyOf(values, size * 2);
        }
        values[size++] = value;
    }

    @Override
    public Value pop() {
        if (size == 0) {
            throw new ImpRuntimeException("Stack underflow");
        }
        Value v = values[--size];
        values[size] = null;
        return v;
    }

    @Override
    public Value peek(int n) {
        if (n < 0 || n >= size) {
            throw new ImpRuntimeException("Stack underflow: peek " + n + " with " + size + " value(s)");
        }
        return values[size - 1 - n];
    }

    @Override
    public long popInt() {
        return expectInt(pop());
    }

    @Override
    public long peekInt() {
        return expectInt(peek(0));
    }

    @Override
    public int size() {
        return size;
    }

    /** 丢弃栈顶 {@code n} 个值 */
    public void drop(int n) {
        if (n < 0 || n > size) {
            throw new ImpRuntimeException("Stack underflow: drop " + n + " with " + size + " value(s)");
        }
        for (int i = 0; i < n; i++) {
            values[--size] = null;
        }
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** 自底向上的只读快照 */
    public List<Value> snapshot() {
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOf(values, size)));
    }

    static long expectInt(Value v) {
        if (!v.isInt()) {
            throw new ImpRuntimeException("Type error: expected integer, got " + v);
        }
        return v.asInt();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < size; i++) {
            if (i > 0) sb.append(", ");
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }
}
