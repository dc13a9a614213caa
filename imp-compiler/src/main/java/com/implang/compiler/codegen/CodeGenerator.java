package com.implang.compiler.codegen;

import com.implang.compiler.ast.AstNode;
import com.implang.compiler.ast.AstVisitor;
import com.implang.compiler.ast.decl.*;
import com.implang.compiler.ast.expr.*;
import com.implang.compiler.ast.stmt.*;
import imp.runtime.NativePrimitive;
import imp.runtime.PrimitiveRegistry;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.bytecode.BytecodeBuffer;
import imp.runtime.bytecode.Opcode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 代码生成器：AST → 字节码
 *
 * <p>字节码布局：顶层语句按源码顺序排在最前并以 {@code STOP} 结束，
 * 随后依次是各函数体，函数只通过入口标签被引用。</p>
 *
 * <p>生成过程中静态跟踪操作数栈深度 {@link #depth}（相对当前函数帧）：
 * 每个压栈指令 +1，{@code POP}/{@code ADD}/{@code JUMP_FALSE} −1，
 * 调用后减去实参个数。参数引用据此计算 {@code PEEK} 距离，
 * {@code RET} 据此给出需丢弃的临时值个数。</p>
 *
 * <p>实例只能翻译一次。</p>
 */
public final class CodeGenerator implements AstVisitor<Void, BindingScope> {

    private static final Logger LOG = Logger.getLogger(CodeGenerator.class.getName());

    private final PrimitiveRegistry primitives;
    private final BytecodeBuffer code = new BytecodeBuffer();
    private final LabelTable labels = new LabelTable();
    private final Map<String, Label> functions = new LinkedHashMap<>();

    /** 当前栈深度 */
    private int depth = 0;
    /** 当前正在生成的函数，顶层语句为 null */
    private FunDecl currentFunction;
    private boolean translated;

    public CodeGenerator(PrimitiveRegistry primitives) {
        this.primitives = primitives;
    }

    /**
     * 翻译整个程序
     *
     * @throws CodegenException 原型绑定的原语未注册
     */
    public Bytecode translate(Program program) {
        if (translated) {
            throw new IllegalStateException("CodeGenerator already used");
        }
        translated = true;

        // 登记全部函数与原型
        Map<String, NativePrimitive> prototypes = new HashMap<>();
        for (AstNode item : program.getItems()) {
            if (item instanceof ProtoDecl) {
                ProtoDecl proto = (ProtoDecl) item;
                NativePrimitive primitive = primitives.lookup(proto.getPrimitiveName());
                if (primitive == null) {
                    throw new CodegenException("Missing primitive \"" + proto.getPrimitiveName()
                            + "\" for prototype '" + proto.getName() + "'", proto.getLocation());
                }
                prototypes.put(proto.getName(), primitive);
            } else if (item instanceof FunDecl) {
                functions.put(((FunDecl) item).getName(), labels.newLabel());
            }
        }

        // 顶层语句在最前，字节码起始即程序入口
        BindingScope.Global global = new BindingScope.Global(functions, prototypes);
        for (Statement stmt : program.getStatements()) {
            stmt.accept(this, global);
        }
        code.writeOpcode(Opcode.STOP);

        for (FunDecl func : program.getFunctions()) {
            func.accept(this, global);
        }

        labels.checkResolved();
        Bytecode bytecode = code.toBytecode();
        LOG.fine("Generated " + bytecode.size() + " bytes, " + functions.size()
                + " function(s), " + bytecode.getNatives().size() + " native(s)");
        return bytecode;
    }

    /** 当前静态栈深度 */
    int getDepth() {
        return depth;
    }

    // ============ 声明 ============

    @Override
    public Void visitFunDecl(FunDecl node, BindingScope scope) {
        Label entry = functions.get(node.getName());
        if (entry == null) {
            throw new IllegalStateException("Missing function label: " + node.getName());
        }
        int address = labels.place(entry, code);

        checkDepth(0, "invalid stack depth on function entry");
        currentFunction = node;
        Map<String, Integer> args = new HashMap<>();
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            args.put(params.get(i).getName(), i);
        }
        node.getBody().accept(this, new BindingScope.Function(scope, args));
        checkDepth(0, "invalid stack depth on function exit");
        currentFunction = null;

        LOG.fine(String.format("Function %s at 0x%04x", node.getName(), address));
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, BindingScope scope) {
        int depthIn = depth;
        BindingScope.Block blockScope = new BindingScope.Block(scope);
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, blockScope);
        }
        checkDepth(depthIn, "mismatched block depth on exit");
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, BindingScope scope) {
        Label entry = labels.newLabel();
        Label exit = labels.newLabel();

        labels.place(entry, code);
        node.getCondition().accept(this, scope);
        emitJumpFalse(exit);
        node.getBody().accept(this, scope);
        emitJump(entry);
        labels.place(exit, code);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, BindingScope scope) {
        node.getValue().accept(this, scope);
        emitReturn();
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, BindingScope scope) {
        node.getExpression().accept(this, scope);
        emitPop();
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitIdentifier(Identifier node, BindingScope scope) {
        Binding binding = scope.lookup(node.getName());
        switch (binding.getKind()) {
            case FUNCTION:
                emitPushFunc(binding.getEntry());
                break;
            case NATIVE:
                emitPushNative(binding.getPrimitive());
                break;
            case ARGUMENT:
                emitPeek(depth + binding.getSlot() + 1);
                break;
            default:
                throw new AssertionError(binding.getKind());
        }
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, BindingScope scope) {
        emitPushInt(node.getValue());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, BindingScope scope) {
        node.getLeft().accept(this, scope);
        node.getRight().accept(this, scope);
        switch (node.getOperator()) {
            case ADD:
                emitAdd();
                break;
            default:
                throw new AssertionError(node.getOperator());
        }
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, BindingScope scope) {
        List<Expression> args = node.getArgs();
        for (int i = args.size() - 1; i >= 0; i--) {
            args.get(i).accept(this, scope);
        }
        node.getCallee().accept(this, scope);
        emitCall();
        // 被调方弹出实参与被调值并压入一个结果
        depth -= args.size();
        return null;
    }

    // ============ 指令发射 ============

    private void emitPop() {
        requireOperand("POP");
        depth -= 1;
        code.writeOpcode(Opcode.POP);
    }

    private void emitCall() {
        code.writeOpcode(Opcode.CALL);
    }

    private void emitPushFunc(Label entry) {
        depth += 1;
        code.writeOpcode(Opcode.PUSH_FUNC);
        labels.reference(entry, code);
    }

    private void emitPushNative(NativePrimitive primitive) {
        depth += 1;
        code.writeOpcode(Opcode.PUSH_NATIVE);
        code.writeInt(code.internNative(primitive));
    }

    private void emitPushInt(long value) {
        depth += 1;
        code.writeOpcode(Opcode.PUSH_INT);
        code.writeLong(value);
    }

    private void emitPeek(int index) {
        depth += 1;
        code.writeOpcode(Opcode.PEEK);
        code.writeInt(index);
    }

    private void emitReturn() {
        requireOperand("RET");
        depth -= 1;
        code.writeOpcode(Opcode.RET);
        code.writeInt(depth);
        code.writeInt(currentFunction != null ? currentFunction.getArity() : 0);
    }

    private void emitAdd() {
        requireOperand("ADD");
        depth -= 1;
        code.writeOpcode(Opcode.ADD);
    }

    private void emitJumpFalse(Label target) {
        requireOperand("JUMP_FALSE");
        depth -= 1;
        code.writeOpcode(Opcode.JUMP_FALSE);
        labels.reference(target, code);
    }

    private void emitJump(Label target) {
        code.writeOpcode(Opcode.JUMP);
        labels.reference(target, code);
    }

    private void requireOperand(String op) {
        if (depth <= 0) {
            throw new IllegalStateException("Generator bug: " + op + " with no elements on stack");
        }
    }

    private void checkDepth(int expected, String what) {
        if (depth != expected) {
            throw new IllegalStateException("Generator bug: " + what
                    + " (expected " + expected + ", got " + depth + ")");
        }
    }
}
