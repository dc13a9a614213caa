package com.implang.cli;

import com.implang.compiler.analysis.AnalysisResult;
import com.implang.compiler.parser.ParseException;
import imp.runtime.Imp;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：只做解析与校验，输出诊断
 */
@Command(name = "check", description = "解析并校验源码文件，不执行")
public class CheckCommand implements Callable<Integer> {

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
            AnalysisResult result = new Imp().setStderr(parent.err).check(source, file);
            if (ScriptRunner.reportDiagnostics(result.getDiagnostics(), parent.err)) {
                return 1;
            }
            parent.out.println(file + ": 检查通过");
            return 0;
        } catch (ParseException e) {
            ScriptRunner.reportParseError(e, source, file, parent.err);
            return 1;
        }
    }
}
