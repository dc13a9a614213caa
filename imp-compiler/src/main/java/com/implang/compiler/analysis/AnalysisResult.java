package com.implang.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final Scope globalScope;
    private final List<SemanticDiagnostic> diagnostics;

    public AnalysisResult(Scope globalScope, List<SemanticDiagnostic> diagnostics) {
        this.globalScope = globalScope;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Scope getGlobalScope() { return globalScope; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    public List<SemanticDiagnostic> getErrors() {
        List<SemanticDiagnostic> errors = new ArrayList<>();
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) errors.add(d);
        }
        return errors;
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    /**
     * 存在 ERROR 级诊断时抛出 {@link VerificationException}
     */
    public AnalysisResult throwIfErrors() {
        if (hasErrors()) {
            throw new VerificationException(getErrors());
        }
        return this;
    }
}
