package imp.runtime;

/**
 * 原生例程：在虚拟机的操作数栈上直接运行的宿主函数
 *
 * <p>调用约定：弹出声明数量的参数，恰好压入一个结果。</p>
 */
@FunctionalInterface
public interface NativeRoutine {
    void invoke(OperandStack stack);
}
