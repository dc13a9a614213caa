package imp.runtime.bytecode;

import java.util.ArrayList;
import java.util.List;

/**
 * 字节码反汇编器
 *
 * <pre>
 * 0000  PUSH_INT    3
 * 0009  PUSH_FUNC   0x0020
 * 000e  CALL
 * </pre>
 */
public final class Disassembler {

    private Disassembler() {}

    public static String disassemble(Bytecode code) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines(code)) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    public static List<String> lines(Bytecode code) {
        List<String> out = new ArrayList<>();
        BytecodeReader reader = code.reader();
        while (reader.hasMore()) {
            int at = reader.getPc();
            Opcode op = reader.readOpcode();
            out.add(String.format("%04x  %s", at, format(op, reader, code)));
        }
        return out;
    }

    private static String format(Opcode op, BytecodeReader reader, Bytecode code) {
        String name = String.format("%-11s", op.name());
        switch (op) {
            case PUSH_FUNC:
            case JUMP_FALSE:
            case JUMP:
                return name + " " + String.format("0x%04x", reader.readInt());
            case PUSH_NATIVE: {
                int index = reader.readInt();
                return name + " #" + index + " <" + code.getNative(index).getName() + ">";
            }
            case PUSH_INT:
                return name + " " + reader.readLong();
            case PEEK:
                return name + " " + reader.readInt();
            case RET: {
                int depth = reader.readInt();
                int nargs = reader.readInt();
                return name + " depth=" + depth + " nargs=" + nargs;
            }
            default:
                return op.name();
        }
    }
}
