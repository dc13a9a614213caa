package imp.runtime.bytecode;

import imp.runtime.NativePrimitive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译完成的字节码（只读）
 *
 * <p>由代码生成器构建一次，交给一个虚拟机实例执行。原生表中的原语身份
 * 只在生成它的进程内有效，字节码不用于持久化。</p>
 */
public final class Bytecode {

    private final byte[] code;
    private final List<NativePrimitive> natives;

    Bytecode(byte[] code, List<NativePrimitive> natives) {
        this.code = code;
        this.natives = Collections.unmodifiableList(new ArrayList<>(natives));
    }

    public int size() {
        return code.length;
    }

    public int readByte(int offset) {
        check(offset, 1);
        return code[offset] & 0xFF;
    }

    public int readInt(int offset) {
        check(offset, 4);
        return getInt(code, offset);
    }

    public long readLong(int offset) {
        check(offset, 8);
        long hi = getInt(code, offset) & 0xFFFFFFFFL;
        long lo = getInt(code, offset + 4) & 0xFFFFFFFFL;
        return (hi << 32) | lo;
    }

    public NativePrimitive getNative(int index) {
        if (index < 0 || index >= natives.size()) {
            throw new BytecodeException("Native index " + index + " out of range", -1);
        }
        return natives.get(index);
    }

    public List<NativePrimitive> getNatives() {
        return natives;
    }

    /** 从偏移 0 开始的读取游标 */
    public BytecodeReader reader() {
        return new BytecodeReader(this);
    }

    /** 字节副本 */
    public byte[] toByteArray() {
        return code.clone();
    }

    private void check(int offset, int width) {
        if (offset < 0 || offset + width > code.length) {
            throw new BytecodeException("Read past end of bytecode (size " + code.length + ")", offset);
        }
    }

    static int getInt(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 24)
                | ((data[offset + 1] & 0xFF) << 16)
                | ((data[offset + 2] & 0xFF) << 8)
                | (data[offset + 3] & 0xFF);
    }
}
