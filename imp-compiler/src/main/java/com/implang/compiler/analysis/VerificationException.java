package com.implang.compiler.analysis;

import imp.runtime.ImpException;

import java.util.List;

/**
 * 程序未通过校验
 */
public class VerificationException extends ImpException {
    private final List<SemanticDiagnostic> errors;

    public VerificationException(List<SemanticDiagnostic> errors) {
        super(format(errors));
        this.errors = errors;
    }

    public List<SemanticDiagnostic> getErrors() {
        return errors;
    }

    private static String format(List<SemanticDiagnostic> errors) {
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" verification errors");
        for (SemanticDiagnostic d : errors) {
            sb.append("\n  ").append(d);
        }
        return sb.toString();
    }
}
