package imp.runtime.bytecode;

/**
 * 字节码读取游标
 *
 * <p>每次读取后游标前进所读类型的宽度。虚拟机以此作为程序计数器。</p>
 */
public final class BytecodeReader {

    private final Bytecode code;
    private int pc;

    public BytecodeReader(Bytecode code) {
        this.code = code;
    }

    public int getPc() {
        return pc;
    }

    /** 跳转到目标偏移 */
    public void jump(int target) {
        if (target < 0 || target >= code.size()) {
            throw new BytecodeException("Jump target out of range", target);
        }
        pc = target;
    }

    public boolean hasMore() {
        return pc < code.size();
    }

    public Opcode readOpcode() {
        int at = pc;
        int b = code.readByte(pc);
        pc += 1;
        Opcode op = Opcode.fromCode(b);
        if (op == null) {
            throw new BytecodeException(String.format("Invalid opcode 0x%02x", b), at);
        }
        return op;
    }

    public int readInt() {
        int v = code.readInt(pc);
        pc += 4;
        return v;
    }

    public long readLong() {
        long v = code.readLong(pc);
        pc += 8;
        return v;
    }
}
