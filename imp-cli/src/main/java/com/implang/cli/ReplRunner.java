package com.implang.cli;

import com.implang.compiler.analysis.AnalysisResult;
import com.implang.compiler.analysis.VerificationException;
import com.implang.compiler.ast.decl.Program;
import com.implang.compiler.parser.ParseException;
import imp.runtime.Imp;
import imp.runtime.ImpException;
import imp.runtime.interpreter.ImpRuntimeException;
import imp.runtime.interpreter.ImpSecurityPolicy;
import imp.runtime.interpreter.InputReader;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 *
 * <p>只含函数声明的输入被保留，之后的输入都可以引用它们；
 * 含语句的输入与已保留的声明一起编译并立即执行，执行后不保留。</p>
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());
    private static final String VERSION = "0.1.0";
    private static final String FILE_NAME = "<repl>";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final StringBuilder declarations = new StringBuilder();
    /** 行读取与 read_int 共用，输入只包装一次 */
    private final InputReader input;
    private final Imp imp;

    public ReplRunner(ImpSecurityPolicy policy, InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.input = new InputReader(in);
        this.imp = new Imp(policy).setInput(input).setStdout(out).setStderr(err);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        if (in != System.in) {
            runFallbackLoop();
        } else {
            try {
                Terminal terminal = TerminalBuilder.builder().system(true).build();
                LineReader reader = LineReaderBuilder.builder()
                        .terminal(terminal)
                        .parser(new DefaultParser())
                        .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                        .build();

                runLoop(reader);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "终端初始化失败，回退到简单模式", e);
                runFallbackLoop();
            }
        }

        out.println("\n再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder multilineBuffer = new StringBuilder();
        boolean inMultiline = false;

        while (true) {
            try {
                String prompt = inMultiline ? "... " : "imp> ";
                String line = reader.readLine(prompt);

                if (line == null) break;

                if (!inMultiline && line.startsWith(":")) {
                    if (!handleReplCommand(line.trim())) break;
                    continue;
                }

                // 未闭合括号自动续行
                if (hasUnclosedBrackets(multilineBuffer.toString() + line)) {
                    multilineBuffer.append(line).append("\n");
                    inMultiline = true;
                    continue;
                }

                if (inMultiline) {
                    multilineBuffer.append(line);
                    line = multilineBuffer.toString();
                    multilineBuffer.setLength(0);
                    inMultiline = false;
                }

                if (line.trim().isEmpty()) continue;

                evaluate(line);

            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
                inMultiline = false;
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（非终端输入或 jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop() {
        StringBuilder multilineBuffer = new StringBuilder();
        boolean inMultiline = false;

        while (true) {
            try {
                out.print(inMultiline ? "... " : "imp> ");
                out.flush();

                String line = input.readLine();
                if (line == null) break;

                if (!inMultiline && line.startsWith(":")) {
                    if (!handleReplCommand(line.trim())) break;
                    continue;
                }

                if (hasUnclosedBrackets(multilineBuffer.toString() + line)) {
                    multilineBuffer.append(line).append("\n");
                    inMultiline = true;
                    continue;
                }

                if (inMultiline) {
                    multilineBuffer.append(line);
                    line = multilineBuffer.toString();
                    multilineBuffer.setLength(0);
                    inMultiline = false;
                }

                if (line.trim().isEmpty()) continue;

                evaluate(line);

            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 检查是否有未闭合的括号
     */
    static boolean hasUnclosedBrackets(String text) {
        int braces = 0;
        int parens = 0;
        boolean inString = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inString = !inString;
                continue;
            }
            if (inString) continue;

            switch (c) {
                case '{': braces++; break;
                case '}': braces--; break;
                case '(': parens++; break;
                case ')': parens--; break;
                default: break;
            }
        }

        return braces > 0 || parens > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":version".equals(command)) {
            out.println("IMP v" + VERSION);
            out.println("Java: " + System.getProperty("java.version"));
            return true;
        }

        if (":reset".equals(command)) {
            declarations.setLength(0);
            out.println("声明已清空");
            return true;
        }

        if (":decls".equals(command)) {
            out.print(declarations);
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    /**
     * 求值一次输入
     *
     * @return 是否成功
     */
    boolean evaluate(String input) {
        String source = declarations + input + "\n";
        try {
            Program parsed = imp.parse(input, FILE_NAME);
            if (parsed.getStatements().isEmpty()) {
                AnalysisResult result = imp.check(source, FILE_NAME);
                if (ScriptRunner.reportDiagnostics(result.getDiagnostics(), err)) {
                    return false;
                }
                declarations.append(input).append('\n');
                out.println("已定义 " + parsed.getItems().size() + " 个声明");
                return true;
            }
            imp.eval(source, FILE_NAME);
            return true;
        } catch (ParseException e) {
            err.println("语法错误: " + e.getMessage());
        } catch (VerificationException e) {
            ScriptRunner.reportDiagnostics(e.getErrors(), err);
        } catch (ImpRuntimeException e) {
            err.println("运行时错误: " + e.getMessage());
        } catch (ImpException e) {
            err.println("错误: " + e.getMessage());
        }
        return false;
    }

    String getDeclarations() {
        return declarations.toString();
    }

    private void printBanner() {
        out.println("  ___ __  __ ___ ");
        out.println(" |_ _|  \\/  | _ \\");
        out.println("  | || |\\/| |  _/");
        out.println(" |___|_|  |_|_|  ");
        out.println("IMP v" + VERSION + " - 字节码虚拟机");
        out.println();
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :version         显示版本");
        out.println("  :reset           清空已保留的声明");
        out.println("  :decls           显示已保留的声明");
        out.println();
        out.println("示例:");
        out.println("  func print(v: int): int = \"print_int\"    声明原型");
        out.println("  func add(a: int, b: int): int { return a + b }");
        out.println("  print(add(2, 3))");
        out.println();
        out.println("提示:");
        out.println("  - 只含声明的输入会被保留");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
