package com.implang.cli;

import com.implang.compiler.analysis.SemanticDiagnostic;
import com.implang.compiler.analysis.VerificationException;
import com.implang.compiler.codegen.CodegenException;
import com.implang.compiler.parser.ParseException;
import imp.runtime.Imp;
import imp.runtime.ImpException;
import imp.runtime.interpreter.ImpRuntimeException;
import imp.runtime.interpreter.ImpSecurityPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 脚本和源码片段执行器
 *
 * <p>所有方法返回进程退出码：成功 0，任何错误 1。</p>
 */
public class ScriptRunner {

    private final ImpSecurityPolicy policy;
    private final boolean trace;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(ImpSecurityPolicy policy, boolean trace,
                        InputStream in, PrintStream out, PrintStream err) {
        this.policy = policy;
        this.trace = trace;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    /**
     * 执行源码文件
     */
    public int runScript(String filePath) {
        String source = readSource(filePath, err);
        if (source == null) {
            return 1;
        }
        return runSource(source, filePath);
    }

    /**
     * 执行命令行给出的源码
     */
    public int runExpression(String source) {
        return runSource(source, "<cmdline>");
    }

    private int runSource(String source, String fileName) {
        try {
            newImp().eval(source, fileName);
            return 0;
        } catch (ParseException e) {
            reportParseError(e, source, fileName, err);
        } catch (VerificationException e) {
            reportDiagnostics(e.getErrors(), err);
        } catch (CodegenException e) {
            err.println("编译错误: " + e.getMessage());
        } catch (ImpRuntimeException e) {
            err.println("运行时错误: " + e.getMessage());
        } catch (ImpException e) {
            err.println("错误: " + e.getMessage());
        }
        return 1;
    }

    private Imp newImp() {
        return new Imp(policy)
                .setStdin(in)
                .setStdout(out)
                .setStderr(err)
                .setTrace(trace);
    }

    // ── 报告工具（子命令与 REPL 共用） ─────────────────────

    /**
     * 读取源码文件，失败时输出错误并返回 null
     */
    static String readSource(String filePath, PrintStream err) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return null;
        }
        if (!Files.isReadable(path)) {
            err.println("错误: 无法读取文件 - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return null;
        }
    }

    static void reportParseError(ParseException e, String source, String fileName, PrintStream err) {
        err.println("语法错误: " + e.getMessage());
        if (e.getToken() != null && source != null) {
            printSourceLocation(source, fileName, e.getToken().getLine(),
                    e.getToken().getColumn(), e.getToken().getLexeme().length(), err);
        }
    }

    /**
     * 输出校验诊断
     *
     * @return 是否存在 ERROR 级诊断
     */
    static boolean reportDiagnostics(List<SemanticDiagnostic> diagnostics, PrintStream err) {
        boolean hasError = false;
        for (SemanticDiagnostic diag : diagnostics) {
            String prefix;
            switch (diag.getSeverity()) {
                case ERROR:   prefix = "验证错误"; hasError = true; break;
                case WARNING: prefix = "警告"; break;
                default:      prefix = "诊断"; break;
            }
            String location = "";
            if (diag.getLocation() != null) {
                location = " (" + diag.getLocation() + ")";
            }
            err.println(prefix + ":" + location + " " + diag.getMessage());
        }
        return hasError;
    }

    /**
     * 打印源码位置指示（文件名:行:列 + 源码行 + 下划线指针）
     */
    static void printSourceLocation(String source, String fileName, int line, int column, int length,
                                    PrintStream err) {
        err.println("  --> " + fileName + ":" + line + ":" + column);
        String[] lines = source.split("\n", -1);
        if (line >= 1 && line <= lines.length) {
            String lineText = lines[line - 1];
            String lineNum = String.valueOf(line);
            err.println("   |");
            err.println(" " + lineNum + " | " + lineText);
            StringBuilder pointer = new StringBuilder();
            for (int i = 0; i < lineNum.length() + 1; i++) pointer.append(' ');
            pointer.append("| ");
            for (int i = 1; i < column; i++) pointer.append(' ');
            for (int i = 0; i < Math.max(1, length); i++) pointer.append('^');
            err.println(pointer.toString());
        }
    }
}
