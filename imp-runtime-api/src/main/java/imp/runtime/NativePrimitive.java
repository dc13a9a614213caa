package imp.runtime;

/**
 * 原生原语（名称 + 参数个数 + 例程）
 *
 * <p>实例的对象身份即字节码中的原生函数标识，比较使用 {@code ==}。</p>
 */
public final class NativePrimitive {

    private final String name;
    private final int arity;
    private final NativeRoutine routine;

    public NativePrimitive(String name, int arity, NativeRoutine routine) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be >= 0: " + arity);
        }
        this.name = name;
        this.arity = arity;
        this.routine = routine;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public void invoke(OperandStack stack) {
        routine.invoke(stack);
    }

    @Override
    public String toString() {
        return "<native " + name + "/" + arity + ">";
    }
}
