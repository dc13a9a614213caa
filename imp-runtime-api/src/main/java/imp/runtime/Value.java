package imp.runtime;

/**
 * 虚拟机操作数栈上的值（带标签的变体）
 *
 * <p>三种形态：原生函数标识、代码地址、64 位有符号整数。值按值复制，
 * 不引用任何堆对象，因此无需垃圾回收。</p>
 */
public final class Value {

    /** 值的种类 */
    public enum Kind {
        NATIVE,
        ADDRESS,
        INT
    }

    // 小整数缓存
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final Value[] CACHE = new Value[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new Value(Kind.INT, CACHE_LOW + i, null);
        }
    }

    public static final Value ZERO = ofInt(0);

    private final Kind kind;
    private final long bits;                 // INT 的值或 ADDRESS 的偏移
    private final NativePrimitive primitive; // 仅 NATIVE

    private Value(Kind kind, long bits, NativePrimitive primitive) {
        this.kind = kind;
        this.bits = bits;
        this.primitive = primitive;
    }

    public static Value ofInt(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new Value(Kind.INT, value, null);
    }

    public static Value ofAddress(int address) {
        return new Value(Kind.ADDRESS, address, null);
    }

    public static Value ofNative(NativePrimitive primitive) {
        if (primitive == null) {
            throw new IllegalArgumentException("primitive must not be null");
        }
        return new Value(Kind.NATIVE, 0, primitive);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInt() {
        return kind == Kind.INT;
    }

    public boolean isAddress() {
        return kind == Kind.ADDRESS;
    }

    public boolean isNative() {
        return kind == Kind.NATIVE;
    }

    public long asInt() {
        if (kind != Kind.INT) {
            throw new IllegalStateException("Not an integer: " + this);
        }
        return bits;
    }

    public int asAddress() {
        if (kind != Kind.ADDRESS) {
            throw new IllegalStateException("Not a code address: " + this);
        }
        return (int) bits;
    }

    public NativePrimitive asNative() {
        if (kind != Kind.NATIVE) {
            throw new IllegalStateException("Not a native primitive: " + this);
        }
        return primitive;
    }

    /**
     * 布尔转换：原生函数与代码地址恒为真，整数非零为真。
     */
    public boolean isTruthy() {
        switch (kind) {
            case NATIVE:
            case ADDRESS:
                return true;
            case INT:
                return bits != 0;
            default:
                throw new IllegalStateException("Unknown value kind: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return kind == other.kind && bits == other.bits && primitive == other.primitive;
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = 31 * h + Long.hashCode(bits);
        h = 31 * h + (primitive != null ? System.identityHashCode(primitive) : 0);
        return h;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NATIVE:
                return "<native " + primitive.getName() + ">";
            case ADDRESS:
                return String.format("<addr 0x%04x>", bits);
            default:
                return Long.toString(bits);
        }
    }
}
