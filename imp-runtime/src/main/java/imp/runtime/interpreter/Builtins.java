package imp.runtime.interpreter;

import imp.runtime.PrimitiveRegistry;

import java.io.InputStream;
import java.io.PrintStream;

/**
 * 内置原生原语注册
 *
 * <ul>
 *   <li>{@code print_int}（1 个参数）：弹出整数并换行输出，再压回该整数作为结果</li>
 *   <li>{@code read_int}（无参数）：读取下一个以空白分隔的整数并压入</li>
 * </ul>
 *
 * <p>标准输入输出权限在调用时检查，策略禁止时抛出 {@link ImpRuntimeException}。</p>
 */
public final class Builtins {

    public static final String PRINT_INT = "print_int";
    public static final String READ_INT = "read_int";

    private Builtins() {}

    /**
     * 使用 {@code System.in} / {@code System.out} 创建注册表（默认无限制策略）
     */
    public static PrimitiveRegistry createRegistry() {
        return createRegistry(System.in, System.out, ImpSecurityPolicy.unrestricted());
    }

    /**
     * 创建包含全部内置原语的注册表
     */
    public static PrimitiveRegistry createRegistry(InputStream in, PrintStream out, ImpSecurityPolicy policy) {
        return createRegistry(new InputReader(in), out, policy);
    }

    /**
     * 创建包含全部内置原语的注册表，{@code read_int} 从给定读取器取数
     */
    public static PrimitiveRegistry createRegistry(InputReader input, PrintStream out, ImpSecurityPolicy policy) {
        PrimitiveRegistry registry = new PrimitiveRegistry();

        registry.register(PRINT_INT, 1, stack -> {
            checkStdio(policy, PRINT_INT);
            long v = stack.popInt();
            out.println(v);
            out.flush();
            stack.pushInt(v);
        });

        registry.register(READ_INT, 0, stack -> {
            checkStdio(policy, READ_INT);
            stack.pushInt(input.nextInt());
        });

        return registry;
    }

    private static void checkStdio(ImpSecurityPolicy policy, String primitive) {
        if (!policy.isStdioAllowed()) {
            throw ImpSecurityPolicy.denied("stdio (" + primitive + ")");
        }
    }
}
