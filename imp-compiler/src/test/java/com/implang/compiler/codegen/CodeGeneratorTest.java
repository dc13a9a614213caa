package com.implang.compiler.codegen;

import com.implang.compiler.ast.decl.Program;
import com.implang.compiler.lexer.Lexer;
import com.implang.compiler.parser.Parser;
import imp.runtime.PrimitiveRegistry;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.bytecode.Disassembler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CodeGenerator 代码生成")
class CodeGeneratorTest {

    private static PrimitiveRegistry registry() {
        return new PrimitiveRegistry()
                .register("print_int", 1, stack -> { })
                .register("read_int", 0, stack -> stack.pushInt(0));
    }

    private static Program parse(String source) {
        return new Parser(new Lexer(source, "<test>")).parse();
    }

    private static Bytecode generate(String source) {
        return new CodeGenerator(registry()).translate(parse(source));
    }

    @Nested
    @DisplayName("布局")
    class Layout {

        @Test
        @DisplayName("空程序只有 STOP")
        void emptyProgram() {
            Bytecode code = generate("");
            assertEquals(1, code.size());
            assertEquals(Arrays.asList("0000  STOP"), Disassembler.lines(code));
        }

        @Test
        @DisplayName("字面量语句压栈后丢弃")
        void literalStatement() {
            assertEquals(Arrays.asList(
                    "0000  PUSH_INT    5",
                    "0009  POP",
                    "000a  STOP"), Disassembler.lines(generate("5")));
        }

        @Test
        @DisplayName("顶层语句在前，函数体在 STOP 之后")
        void callAndAdd() {
            Bytecode code = generate(
                    "func print(v: int): int = \"print_int\";\n"
                  + "func add(a: int, b: int): int { return a + b };\n"
                  + "print(add(2, 3))");

            assertEquals(Arrays.asList(
                    "0000  PUSH_INT    3",
                    "0009  PUSH_INT    2",
                    "0012  PUSH_FUNC   0x0020",
                    "0017  CALL",
                    "0018  PUSH_NATIVE #0 <print_int>",
                    "001d  CALL",
                    "001e  POP",
                    "001f  STOP",
                    "0020  PEEK        1",
                    "0025  PEEK        3",
                    "002a  ADD",
                    "002b  RET         depth=0 nargs=2"), Disassembler.lines(code));
            assertEquals(52, code.size());
            assertEquals(0x20, code.readInt(0x13));
        }

        @Test
        @DisplayName("函数体可以引用后声明的函数")
        void forwardReference() {
            Bytecode code = generate(
                    "func first(): int { return second() };\n"
                  + "func second(): int { return 7 }");
            assertEquals(Arrays.asList(
                    "0000  STOP",
                    "0001  PUSH_FUNC   0x0010",
                    "0006  CALL",
                    "0007  RET         depth=0 nargs=0",
                    "0010  PUSH_INT    7",
                    "0019  RET         depth=0 nargs=0"), Disassembler.lines(code));
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlow {

        @Test
        @DisplayName("while 循环回填跳转地址")
        void whileLoop() {
            Bytecode code = generate(
                    "func read(): int = \"read_int\";\n"
                  + "func print(v: int): int = \"print_int\";\n"
                  + "while (read()) { print(1) }");

            assertEquals(Arrays.asList(
                    "0000  PUSH_NATIVE #0 <read_int>",
                    "0005  CALL",
                    "0006  JUMP_FALSE  0x0020",
                    "000b  PUSH_INT    1",
                    "0014  PUSH_NATIVE #1 <print_int>",
                    "0019  CALL",
                    "001a  POP",
                    "001b  JUMP        0x0000",
                    "0020  STOP"), Disassembler.lines(code));
            assertEquals(33, code.size());
        }

        @Test
        @DisplayName("同一原语只入表一次")
        void nativeInterned() {
            Bytecode code = generate(
                    "func print(v: int): int = \"print_int\";\n"
                  + "func show(v: int): int = \"print_int\";\n"
                  + "print(1); show(2); print(3)");
            assertEquals(1, code.getNatives().size());
            assertEquals("print_int", code.getNative(0).getName());
        }
    }

    @Nested
    @DisplayName("参数寻址")
    class Arguments {

        @Test
        @DisplayName("嵌套调用中的参数距离随栈深度增长")
        void nestedPeek() {
            Bytecode code = generate(
                    "func id(x: int): int { return x };\n"
                  + "func h(a: int): int { return a + id(a) }");

            assertEquals(Arrays.asList(
                    "0000  STOP",
                    "0001  PEEK        1",
                    "0006  RET         depth=0 nargs=1",
                    "000f  PEEK        1",
                    "0014  PEEK        2",
                    "0019  PUSH_FUNC   0x0001",
                    "001e  CALL",
                    "001f  ADD",
                    "0020  RET         depth=0 nargs=1"), Disassembler.lines(code));
        }

        @Test
        @DisplayName("while 中的 return 按当前深度丢弃临时值")
        void returnInsideLoop() {
            Bytecode code = generate(
                    "func f(n: int): int { while (n) { return n + 1 } return 0 }");
            assertTrue(Disassembler.lines(code).contains("001a  RET         depth=0 nargs=1"));
        }
    }

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("原型绑定的原语未注册")
        void missingPrimitive() {
            CodeGenerator gen = new CodeGenerator(registry());
            CodegenException e = assertThrows(CodegenException.class,
                    () -> gen.translate(parse("func beep(): int = \"beep\"")));
            assertTrue(e.getMessage().contains("Missing primitive \"beep\" for prototype 'beep'"));
        }

        @Test
        @DisplayName("未经校验的未知名字是内部错误")
        void unboundName() {
            CodeGenerator gen = new CodeGenerator(registry());
            assertThrows(IllegalStateException.class, () -> gen.translate(parse("nope")));
        }

        @Test
        @DisplayName("生成器只能使用一次")
        void singleUse() {
            CodeGenerator gen = new CodeGenerator(registry());
            gen.translate(parse("1"));
            assertEquals(0, gen.getDepth());
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> gen.translate(parse("1")));
            assertEquals("CodeGenerator already used", e.getMessage());
        }
    }
}
