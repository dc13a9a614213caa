package imp.runtime.bytecode;

import imp.runtime.NativePrimitive;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 可增长的字节码缓冲区（代码生成器写入端）
 *
 * <p>顺序写入指令，并支持按偏移回填 4 字节操作数（标签回填用）。
 * 原生原语按对象身份登记到原生表，字节码中只保存表索引。</p>
 */
public final class BytecodeBuffer {

    private static final int INITIAL_CAPACITY = 64;

    private byte[] data = new byte[INITIAL_CAPACITY];
    private int size;

    private final List<NativePrimitive> natives = new ArrayList<>();
    private final Map<NativePrimitive, Integer> nativeIndex = new IdentityHashMap<>();

    /** 当前写入位置 */
    public int position() {
        return size;
    }

    public void writeOpcode(Opcode op) {
        writeByte(op.getCode());
    }

    public void writeByte(int b) {
        ensureCapacity(1);
        data[size++] = (byte) b;
    }

    public void writeInt(int value) {
        ensureCapacity(4);
        putInt(size, value);
        size += 4;
    }

    public void writeLong(long value) {
        ensureCapacity(8);
        putInt(size, (int) (value >>> 32));
        putInt(size + 4, (int) value);
        size += 8;
    }

    /**
     * 回填已写入位置的 4 字节值
     */
    public void patchInt(int offset, int value) {
        if (offset < 0 || offset + 4 > size) {
            throw new BytecodeException("Patch out of range", offset);
        }
        putInt(offset, value);
    }

    /**
     * 读取已写入位置的 4 字节值（测试与校验用）
     */
    public int readInt(int offset) {
        if (offset < 0 || offset + 4 > size) {
            throw new BytecodeException("Read out of range", offset);
        }
        return Bytecode.getInt(data, offset);
    }

    /**
     * 登记原生原语，返回其在原生表中的索引。同一原语只登记一次。
     */
    public int internNative(NativePrimitive primitive) {
        Integer index = nativeIndex.get(primitive);
        if (index != null) return index;
        int newIndex = natives.size();
        natives.add(primitive);
        nativeIndex.put(primitive, newIndex);
        return newIndex;
    }

    /** 生成只读字节码 */
    public Bytecode toBytecode() {
        return new Bytecode(Arrays.copyOf(data, size), natives);
    }

    private void putInt(int offset, int value) {
        data[offset] = (byte) (value >>> 24);
        data[offset + 1] = (byte) (value >>> 16);
        data[offset + 2] = (byte) (value >>> 8);
        data[offset + 3] = (byte) value;
    }

    private void ensureCapacity(int extra) {
        if (size + extra > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + extra));
        }
    }
}
