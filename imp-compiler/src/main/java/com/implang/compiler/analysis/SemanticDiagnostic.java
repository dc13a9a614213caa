package com.implang.compiler.analysis;

import com.implang.compiler.ast.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING
    }

    private final Severity severity;
    private final String message;
    private final SourceLocation location;

    public SemanticDiagnostic(Severity severity, String message, SourceLocation location) {
        this.severity = severity;
        this.message = message;
        this.location = location;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String where = location != null ? location.toString() : "<unknown>";
        return where + ": " + severity.name().toLowerCase() + ": " + message;
    }
}
