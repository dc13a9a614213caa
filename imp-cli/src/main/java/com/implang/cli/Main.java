package com.implang.cli;

import imp.runtime.interpreter.ImpSecurityPolicy;
import imp.runtime.interpreter.Interpreter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IMP CLI 入口点（picocli）
 */
@Command(name = "imp", version = "IMP v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {DisasmCommand.class, CheckCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = "--sandbox", description = "安全沙箱级别（strict, standard, unrestricted）")
    String sandbox;

    @Option(names = "-e", description = "执行源码")
    String expression;

    @Option(names = "--trace", description = "逐条记录执行的指令")
    boolean trace;

    @Parameters(arity = "0..1", description = "源码文件")
    String file;

    final InputStream in;
    final PrintStream out;
    final PrintStream err;

    public Main() {
        this(System.in, System.out, System.err);
    }

    Main(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        ImpSecurityPolicy policy = resolvePolicy(sandbox);
        if (policy == null) {
            return 1;
        }
        if (trace) {
            enableTrace();
        }

        ScriptRunner runner = new ScriptRunner(policy, trace, in, out, err);
        if (expression != null) {
            return runner.runExpression(expression);
        } else if (file != null) {
            return runner.runScript(file);
        } else {
            new ReplRunner(policy, in, out, err).run();
            return 0;
        }
    }

    ImpSecurityPolicy resolvePolicy(String sandbox) {
        if (sandbox == null) return ImpSecurityPolicy.unrestricted();
        try {
            return ImpSecurityPolicy.forName(sandbox);
        } catch (IllegalArgumentException e) {
            err.println("错误: 未知沙箱级别 '" + sandbox + "'（可选: strict, standard, unrestricted）");
            return null;
        }
    }

    /**
     * 打开解释器日志的 FINE 级别并输出到控制台
     */
    static void enableTrace() {
        Logger logger = Logger.getLogger(Interpreter.class.getName());
        logger.setLevel(Level.FINE);
        for (java.util.logging.Handler h : logger.getHandlers()) {
            if (h instanceof ConsoleHandler) return;
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
    }

    public static void main(String[] args) {
        // Windows 控制台可能不是 UTF-8，使用 native.encoding 获取操作系统原生编码
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            int exitCode = cmd.execute(args);
            System.exit(exitCode);
        } catch (UnsupportedEncodingException e) {
            CommandLine cmd = new CommandLine(new Main());
            int exitCode = cmd.execute(args);
            System.exit(exitCode);
        }
    }

    /**
     * 获取控制台实际使用的字符编码名（Java 17+ 提供 native.encoding）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
