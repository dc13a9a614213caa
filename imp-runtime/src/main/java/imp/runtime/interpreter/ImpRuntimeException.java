package imp.runtime.interpreter;

import imp.runtime.ImpException;

/**
 * IMP 运行时异常
 *
 * <p>类型错误、栈下溢、非法操作码、资源超限等。可携带出错指令的偏移。</p>
 */
public class ImpRuntimeException extends ImpException {

    private final int pc;

    public ImpRuntimeException(String message) {
        this(message, -1);
    }

    public ImpRuntimeException(String message, int pc) {
        super(message);
        this.pc = pc;
    }

    public ImpRuntimeException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ImpRuntimeException(String message, int pc, Throwable cause) {
        super(message, cause);
        this.pc = pc;
    }

    /** 出错指令的偏移，未知时为 -1 */
    public int getPc() {
        return pc;
    }

    /** 返回不含位置信息的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (pc < 0) return super.getMessage();
        return super.getMessage() + String.format(" (pc=0x%04x)", pc);
    }
}
