package imp.runtime.bytecode;

/**
 * 字节码操作码。
 *
 * <p>每条指令以 1 字节操作码开头，后跟定长操作数（大端序）。</p>
 */
public enum Opcode {
    PUSH_FUNC(0x00, 4),     // addr:u32      -> 压入代码地址
    PUSH_NATIVE(0x01, 4),   // index:u32     -> 压入原生函数标识（原生表索引）
    PUSH_INT(0x02, 8),      // value:i64     -> 压入整数

    PEEK(0x03, 4),          // n:u32         -> 复制距栈顶 n 的值
    POP(0x04, 0),
    CALL(0x05, 0),

    ADD(0x06, 0),
    RET(0x07, 8),           // depth:u32 nargs:u32

    JUMP_FALSE(0x08, 4),    // addr:u32
    JUMP(0x09, 4),          // addr:u32
    STOP(0x0A, 0);

    private static final Opcode[] BY_CODE = new Opcode[256];
    static {
        for (Opcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;
    private final int operandBytes;

    Opcode(int code, int operandBytes) {
        this.code = code;
        this.operandBytes = operandBytes;
    }

    public int getCode() {
        return code;
    }

    /** 操作数总字节数 */
    public int getOperandBytes() {
        return operandBytes;
    }

    /** 指令总长度（含操作码字节） */
    public int getLength() {
        return 1 + operandBytes;
    }

    /** 操作数是否为代码地址（需要标签回填） */
    public boolean hasAddressOperand() {
        return this == PUSH_FUNC || this == JUMP_FALSE || this == JUMP;
    }

    /** 按字节值查找操作码，非法值返回 null */
    public static Opcode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) return null;
        return BY_CODE[code];
    }
}
