package com.implang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("imp 命令行")
class MainTest {

    private static final String PRELUDE = "func print(v: int): int = \"print_int\"\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int execute(String stdin, String... args) {
        Main main = new Main(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(main).execute(args);
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static Path write(Path dir, String name, String source) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("执行")
    class Run {

        @Test
        @DisplayName("-e 执行源码")
        void expression() {
            assertEquals(0, execute("", "-e", PRELUDE + "print(1 + 2)"));
            assertEquals("3\n", stdout());
            assertEquals("", stderr());
        }

        @Test
        @DisplayName("执行文件并读取标准输入")
        void script(@TempDir Path dir) throws IOException {
            Path file = write(dir, "sum.imp", PRELUDE
                    + "func read(): int = \"read_int\"\n"
                    + "print(read() + read())\n");
            assertEquals(0, execute("40 2", file.toString()));
            assertEquals("42\n", stdout());
        }

        @Test
        @DisplayName("文件不存在")
        void missingFile(@TempDir Path dir) {
            assertEquals(1, execute("", dir.resolve("none.imp").toString()));
            assertTrue(stderr().startsWith("错误: 文件不存在"));
        }

        @Test
        @DisplayName("未知沙箱级别")
        void unknownSandbox() {
            assertEquals(1, execute("", "--sandbox", "paranoid", "-e", "1"));
            assertTrue(stderr().contains("未知沙箱级别 'paranoid'"));
        }

        @Test
        @DisplayName("严格沙箱拒绝输出")
        void strictSandbox() {
            assertEquals(1, execute("", "--sandbox", "strict", "-e", PRELUDE + "print(1)"));
            assertTrue(stderr().startsWith("运行时错误: Security policy denied"));
            assertEquals("", stdout());
        }

        @Test
        @DisplayName("语法错误显示源码位置")
        void syntaxError() {
            assertEquals(1, execute("", "-e", "print(1"));
            String e = stderr();
            assertTrue(e.startsWith("语法错误: "), e);
            assertTrue(e.contains("--> <cmdline>:1:"), e);
        }

        @Test
        @DisplayName("执行时显示校验警告")
        void warningShown() {
            assertEquals(1, execute("", "-e", "5(1)"));
            String e = stderr();
            assertTrue(e.startsWith("<cmdline>:1:2: warning: Calling an integer literal"), e);
            assertTrue(e.contains("运行时错误: Type error: cannot call integer 5"), e);
        }

        @Test
        @DisplayName("校验错误")
        void verificationError() {
            assertEquals(1, execute("", "-e", "nope"));
            assertTrue(stderr().contains("验证错误: (<cmdline>:1:1) Unknown name 'nope'"), stderr());
        }
    }

    @Nested
    @DisplayName("子命令")
    class Subcommands {

        @Test
        @DisplayName("disasm 输出反汇编")
        void disasm(@TempDir Path dir) throws IOException {
            Path file = write(dir, "lit.imp", "5\n");
            assertEquals(0, execute("", "disasm", file.toString()));
            assertEquals("0000  PUSH_INT    5\n0009  POP\n000a  STOP\n", stdout());
        }

        @Test
        @DisplayName("disasm 遇到校验错误")
        void disasmInvalid(@TempDir Path dir) throws IOException {
            Path file = write(dir, "bad.imp", "func f(): int { 1 }\n");
            assertEquals(1, execute("", "disasm", file.toString()));
            assertTrue(stderr().contains("Function 'f' must end with a return statement"));
            assertEquals("", stdout());
        }

        @Test
        @DisplayName("check 通过")
        void checkOk(@TempDir Path dir) throws IOException {
            Path file = write(dir, "ok.imp", PRELUDE + "print(2)\n");
            assertEquals(0, execute("", "check", file.toString()));
            assertEquals(file + ": 检查通过\n", stdout());
        }

        @Test
        @DisplayName("check 只有警告时仍然通过")
        void checkWarning(@TempDir Path dir) throws IOException {
            Path file = write(dir, "warn.imp", "5(1)\n");
            assertEquals(0, execute("", "check", file.toString()));
            assertTrue(stderr().startsWith("警告: "));
        }

        @Test
        @DisplayName("check 报告错误")
        void checkError(@TempDir Path dir) throws IOException {
            Path file = write(dir, "err.imp", "func f(a: int, a: int): int { return a }\n");
            assertEquals(1, execute("", "check", file.toString()));
            assertTrue(stderr().contains("Duplicate parameter 'a'"));
        }
    }
}
