package imp.runtime;

import com.implang.compiler.analysis.AnalysisResult;
import com.implang.compiler.analysis.VerificationException;
import com.implang.compiler.parser.ParseException;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.interpreter.ImpRuntimeException;
import imp.runtime.interpreter.ImpSecurityPolicy;
import imp.runtime.interpreter.Interpreter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Imp 便捷 API")
class ImpTest {

    private static final String PRELUDE =
            "func print(v: int): int = \"print_int\";\n"
          + "func read(): int = \"read_int\";\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Imp imp(String stdin) {
        return imp(stdin, ImpSecurityPolicy.unrestricted());
    }

    private Imp imp(String stdin, ImpSecurityPolicy policy) {
        return new Imp(policy)
                .setStdin(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)))
                .setStdout(new PrintStream(out, true))
                .setStderr(new PrintStream(err, true));
    }

    private String stdout() {
        return out.toString().replace("\r\n", "\n");
    }

    private String stderr() {
        return err.toString().replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("程序执行")
    class Programs {

        @Test
        @DisplayName("函数调用与加法")
        void callAndAdd() {
            Interpreter vm = imp("").eval(PRELUDE
                    + "func add(a: int, b: int): int { return a + b };\n"
                    + "print(add(2, 3))");
            assertThat(stdout()).isEqualTo("5\n");
            assertThat(vm.getStack().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("读到零为止回显输入")
        void echoLoop() {
            imp("3 4\n0 9").eval(PRELUDE
                    + "func echo(v: int): int { print(v); return v };\n"
                    + "while (echo(read())) { }");
            assertThat(stdout()).isEqualTo("3\n4\n0\n");
        }

        @Test
        @DisplayName("输入非零时循环")
        void whileRead() {
            imp("3 2 1 0").eval(PRELUDE + "while (read()) { print(1) }");
            assertThat(stdout()).isEqualTo("1\n1\n1\n");
        }

        @Test
        @DisplayName("参数在多层调用中保持正确")
        void nestedArguments() {
            imp("").eval(PRELUDE
                    + "func id(x: int): int { return x };\n"
                    + "func triple(a: int, b: int, c: int): int { return a + id(b) + id(id(c)) };\n"
                    + "print(triple(1, 20, 300))");
            assertThat(stdout()).isEqualTo("321\n");
        }

        @Test
        @DisplayName("顶层语句可调用后声明的函数")
        void forwardReference() {
            imp("").eval(PRELUDE + "print(later(41));\n"
                    + "func later(n: int): int { return n + 1 }");
            assertThat(stdout()).isEqualTo("42\n");
        }

        @Test
        @DisplayName("循环中提前返回")
        void returnFromLoop() {
            imp("0 0 8").eval(PRELUDE
                    + "func firstNonZero(): int { while (1) { while (read()) { return 1 } } return 0 };\n"
                    + "print(firstNonZero())");
            assertThat(stdout()).isEqualTo("1\n");
        }

        @Test
        @DisplayName("同一字节码可重复执行")
        void rerunBytecode() {
            Imp imp = imp("");
            Bytecode code = imp.compile(PRELUDE + "print(7)", "<test>");
            Interpreter first = imp.execute(code);
            Interpreter second = imp.execute(code);
            assertThat(stdout()).isEqualTo("7\n7\n");
            assertThat(second.getInstructionCount()).isEqualTo(first.getInstructionCount());
        }

        @Test
        @DisplayName("同一实例多次编译执行共用标准输入")
        void sharedStdinAcrossPrograms() {
            Imp imp = imp("1 2");
            Bytecode first = imp.compile(PRELUDE + "print(read())", "<first>");
            Bytecode second = imp.compile(PRELUDE + "print(read())", "<second>");
            imp.execute(first);
            imp.execute(second);
            assertThat(stdout()).isEqualTo("1\n2\n");
        }

        @Test
        @DisplayName("连续 eval 接着读取剩余输入")
        void sharedStdinAcrossEval() {
            Imp imp = imp("10\n20\n30\n");
            imp.eval(PRELUDE + "print(read())");
            imp.eval(PRELUDE + "print(read() + read())");
            assertThat(stdout()).isEqualTo("10\n50\n");
        }

        @Test
        @DisplayName("注册自定义原语")
        void customPrimitive() {
            imp("").registerPrimitive("double", 1, s -> s.pushInt(s.popInt() * 2))
                    .eval(PRELUDE + "func dbl(v: int): int = \"double\";\nprint(dbl(21))");
            assertThat(stdout()).isEqualTo("42\n");
        }

        @Test
        @DisplayName("执行文件")
        void evalFile(@TempDir Path dir) throws IOException {
            File file = dir.resolve("main.imp").toFile();
            Files.write(file.toPath(), (PRELUDE + "print(1 + 2)\n").getBytes(StandardCharsets.UTF_8));
            imp("").evalFile(file);
            assertThat(stdout()).isEqualTo("3\n");
        }

        @Test
        @DisplayName("文件不存在")
        void missingFile(@TempDir Path dir) {
            assertThatThrownBy(() -> imp("").evalFile(dir.resolve("none.imp").toFile()))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageStartingWith("Cannot read file");
        }
    }

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("语法错误")
        void parseError() {
            assertThatThrownBy(() -> imp("").compile("func f(: int", "<test>"))
                    .isInstanceOf(ParseException.class);
        }

        @Test
        @DisplayName("校验错误阻止生成代码")
        void verificationError() {
            assertThatThrownBy(() -> imp("").compile(PRELUDE + "print(nope)", "<test>"))
                    .isInstanceOf(VerificationException.class)
                    .hasMessageContaining("Unknown name 'nope'");
        }

        @Test
        @DisplayName("check 只返回诊断")
        void check() {
            AnalysisResult result = imp("").check("func f(a: int): int { a }", "<test>");
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.getErrors()).hasSize(1);
        }

        @Test
        @DisplayName("严格策略禁止输出")
        void strictPolicy() {
            assertThatThrownBy(() -> imp("", ImpSecurityPolicy.strict()).eval(PRELUDE + "print(1)"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("Security policy denied: stdio (print_int)");
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("无限递归触发栈深度上限")
        void unboundedRecursion() {
            ImpSecurityPolicy policy = ImpSecurityPolicy.custom().maxStackDepth(64).build();
            assertThatThrownBy(() -> imp("", policy).eval("func f(): int { return f() };\nf()"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("Stack overflow: depth limit 64 exceeded");
        }

        @Test
        @DisplayName("死循环触发指令数上限")
        void infiniteLoop() {
            ImpSecurityPolicy policy = ImpSecurityPolicy.custom().maxInstructions(1000).build();
            assertThatThrownBy(() -> imp("", policy).eval("while (1) { }"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("Instruction limit exceeded: 1000");
        }

        @Test
        @DisplayName("调用整数是运行时类型错误，之后的语句不执行")
        void callInteger() {
            assertThatThrownBy(() -> imp("").eval(PRELUDE + "5(1);\nprint(2)"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("Type error: cannot call integer 5");
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("编译时校验警告写入 stderr")
        void warningsReported() {
            assertThatThrownBy(() -> imp("").eval("5(1)", "<test>"))
                    .isInstanceOf(ImpRuntimeException.class);
            assertThat(stderr())
                    .isEqualTo("<test>:1:2: warning: Calling an integer literal always fails at runtime\n");
        }

        @Test
        @DisplayName("调用加法结果同样失败")
        void callSum() {
            assertThatThrownBy(() -> imp("").eval(PRELUDE + "print(1);\n(1 + 2)(5);\nprint(2)"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("Type error: cannot call integer 3");
            assertThat(stdout()).isEqualTo("1\n");
        }

        @Test
        @DisplayName("输入耗尽")
        void endOfInput() {
            assertThatThrownBy(() -> imp("").eval(PRELUDE + "read()"))
                    .isInstanceOf(ImpRuntimeException.class)
                    .hasMessageContaining("read_int: end of input");
        }
    }
}
