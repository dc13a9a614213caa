package imp.runtime;

/**
 * 虚拟机操作数栈的访问接口
 *
 * <p>原生例程通过此接口直接读写虚拟机自己的栈。</p>
 */
public interface OperandStack {

    /** 压入一个值 */
    void push(Value value);

    /** 弹出栈顶值，栈为空时抛出运行时错误 */
    Value pop();

    /**
     * 查看距栈顶 {@code n} 个位置的值（0 = 栈顶），不移除
     */
    Value peek(int n);

    /** 弹出栈顶整数，类型不符时抛出运行时错误 */
    long popInt();

    /** 查看栈顶整数 */
    long peekInt();

    /** 当前栈高度 */
    int size();

    default void pushInt(long value) {
        push(Value.ofInt(value));
    }
}
