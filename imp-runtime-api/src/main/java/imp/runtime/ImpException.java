package imp.runtime;

/**
 * IMP 基础异常（无源位置信息）。
 *
 * <p>{@code imp-runtime} 中的 {@code ImpRuntimeException} 与编译器的
 * {@code CodegenException} 均继承此类。</p>
 */
public class ImpException extends RuntimeException {

    public ImpException(String message) {
        super(message);
    }

    public ImpException(String message, Throwable cause) {
        super(message, cause);
    }
}
