package imp.runtime.interpreter;

import imp.runtime.NativePrimitive;
import imp.runtime.Value;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.bytecode.BytecodeException;
import imp.runtime.bytecode.BytecodeReader;
import imp.runtime.bytecode.Opcode;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IMP 虚拟机：单程序计数器的取指/分派循环，遇到 {@code STOP} 正常结束。
 *
 * <p>操作数栈是唯一的运行时存储，保存实参、临时值与返回地址。
 * 调用函数时压入返回地址后跳转；{@code RET depth nargs} 弹出返回值，
 * 丢弃 {@code depth} 个临时值，弹出返回地址并跳转，再丢弃 {@code nargs} 个实参，
 * 最后压回返回值。</p>
 *
 * <p>原生原语直接操作本虚拟机的栈，必须弹出其全部参数并压入一个结果。</p>
 *
 * <p>单线程、不可重入。任何错误以 {@link ImpRuntimeException} 抛出，不做恢复。</p>
 */
public final class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final Bytecode code;
    private final ImpSecurityPolicy policy;
    private ValueStack stack;
    private long instructionCount;
    private boolean trace;
    private boolean running;

    public Interpreter(Bytecode code) {
        this(code, ImpSecurityPolicy.unrestricted());
    }

    public Interpreter(Bytecode code, ImpSecurityPolicy policy) {
        this.code = code;
        this.policy = policy;
        this.stack = new ValueStack(policy.getMaxStackDepth());
    }

    /** 开启后每条指令以 FINE 级别记录日志 */
    public Interpreter setTrace(boolean trace) {
        this.trace = trace;
        return this;
    }

    /** 运行结束时操作数栈的只读快照（自底向上） */
    public List<Value> getStack() {
        return stack.snapshot();
    }

    /** 上次运行执行的指令数 */
    public long getInstructionCount() {
        return instructionCount;
    }

    public ImpSecurityPolicy getPolicy() {
        return policy;
    }

    /**
     * 从偏移 0 开始执行直到 {@code STOP}
     *
     * @throws ImpRuntimeException 类型错误、栈下溢、非法操作码、越界跳转或资源超限
     */
    public void run() {
        if (running) {
            throw new IllegalStateException("Interpreter is not reentrant");
        }
        running = true;
        stack = new ValueStack(policy.getMaxStackDepth());
        instructionCount = 0;
        LOG.fine("VM start: " + code.size() + " bytes");
        try {
            execute(code.reader());
        } catch (BytecodeException e) {
            throw new ImpRuntimeException(e.getMessage(), e);
        } finally {
            running = false;
        }
        LOG.fine("VM stop: " + instructionCount + " instruction(s)");
    }

    private void execute(BytecodeReader reader) {
        final long maxInstructions = policy.getMaxInstructions();
        final boolean tracing = trace && LOG.isLoggable(Level.FINE);

        for (;;) {
            int pc = reader.getPc();
            if (!reader.hasMore()) {
                throw new ImpRuntimeException("Program counter out of range", pc);
            }
            Opcode op = reader.readOpcode();
            instructionCount++;
            if (maxInstructions > 0 && instructionCount > maxInstructions) {
                throw new ImpRuntimeException("Instruction limit exceeded: " + maxInstructions, pc);
            }
            if (tracing) {
                LOG.fine(String.format("%04x  %-11s %s", pc, op.name(), stack));
            }

            try {
                switch (op) {
                    case PUSH_FUNC:
                        stack.push(Value.ofAddress(reader.readInt()));
                        break;
                    case PUSH_NATIVE:
                        stack.push(Value.ofNative(code.getNative(reader.readInt())));
                        break;
                    case PUSH_INT:
                        stack.pushInt(reader.readLong());
                        break;
                    case PEEK:
                        stack.push(stack.peek(reader.readInt()));
                        break;
                    case POP:
                        stack.pop();
                        break;
                    case CALL:
                        call(stack.pop(), reader);
                        break;
                    case ADD: {
                        long rhs = stack.popInt();
                        long lhs = stack.popInt();
                        stack.pushInt(lhs + rhs);
                        break;
                    }
                    case RET: {
                        int depth = reader.readInt();
                        int nargs = reader.readInt();
                        Value result = stack.pop();
                        stack.drop(depth);
                        Value ret = stack.pop();
                        if (!ret.isAddress()) {
                            throw new ImpRuntimeException("Type error: expected return address, got " + ret);
                        }
                        reader.jump(ret.asAddress());
                        stack.drop(nargs);
                        stack.push(result);
                        break;
                    }
                    case JUMP_FALSE: {
                        int target = reader.readInt();
                        if (!stack.pop().isTruthy()) {
                            reader.jump(target);
                        }
                        break;
                    }
                    case JUMP:
                        reader.jump(reader.readInt());
                        break;
                    case STOP:
                        return;
                    default:
                        throw new ImpRuntimeException("Unhandled opcode " + op, pc);
                }
            } catch (ImpRuntimeException e) {
                if (e.getPc() >= 0) throw e;
                throw new ImpRuntimeException(e.getRawMessage(), pc, e);
            }
        }
    }

    private void call(Value callee, BytecodeReader reader) {
        switch (callee.getKind()) {
            case NATIVE: {
                NativePrimitive primitive = callee.asNative();
                int before = stack.size();
                if (before < primitive.getArity()) {
                    throw new ImpRuntimeException("Stack underflow: " + primitive.getName()
                            + " expects " + primitive.getArity() + " argument(s)");
                }
                primitive.invoke(stack);
                int expected = before - primitive.getArity() + 1;
                if (stack.size() != expected) {
                    throw new ImpRuntimeException("Native " + primitive.getName()
                            + " left stack height " + stack.size() + ", expected " + expected);
                }
                break;
            }
            case ADDRESS:
                stack.push(Value.ofAddress(reader.getPc()));
                reader.jump(callee.asAddress());
                break;
            case INT:
                throw new ImpRuntimeException("Type error: cannot call integer " + callee.asInt());
            default:
                throw new AssertionError(callee.getKind());
        }
    }
}
