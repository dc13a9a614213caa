package imp.runtime.bytecode;

import imp.runtime.ImpException;

/**
 * 字节码读写越界或遇到非法操作码
 */
public class BytecodeException extends ImpException {

    private final int offset;

    public BytecodeException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        if (offset < 0) return super.getMessage();
        return super.getMessage() + String.format(" at offset 0x%04x", offset);
    }
}
