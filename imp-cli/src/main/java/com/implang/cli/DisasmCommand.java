package com.implang.cli;

import com.implang.compiler.analysis.VerificationException;
import com.implang.compiler.parser.ParseException;
import imp.runtime.Imp;
import imp.runtime.ImpException;
import imp.runtime.bytecode.Bytecode;
import imp.runtime.bytecode.Disassembler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli disasm 子命令：编译源码文件并输出反汇编
 */
@Command(name = "disasm", description = "编译源码文件并输出字节码反汇编")
public class DisasmCommand implements Callable<Integer> {

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Override
    public Integer call() {
        String source = ScriptRunner.readSource(file, parent.err);
        if (source == null) {
            return 1;
        }
        try {
            Bytecode code = new Imp().setStderr(parent.err).compile(source, file);
            parent.out.print(Disassembler.disassemble(code));
            parent.out.flush();
            return 0;
        } catch (ParseException e) {
            ScriptRunner.reportParseError(e, source, file, parent.err);
        } catch (VerificationException e) {
            ScriptRunner.reportDiagnostics(e.getErrors(), parent.err);
        } catch (ImpException e) {
            parent.err.println("编译错误: " + e.getMessage());
        }
        return 1;
    }
}
