package org.dxworks.celerrate.diagnostics;

/**
 * Stable identifiers for the recoverable issues the mapper reports.
 */
public enum DiagnosticCode {
    DIALECT_CONSTRUCT_DISABLED("P1001", Severity.WARNING),
    DIALECT_CONSTRUCT_REJECTED("P1002", Severity.WARNING),
    DEPRECATED_CONSTRUCT("P1003", Severity.WARNING),
    DIALECT_FALLBACK("P1004", Severity.WARNING),
    AMBIGUOUS_CONSTRUCT("P1005", Severity.ERROR),
    SYNTAX_ERROR("P2001", Severity.ERROR),
    MISSING_NODE("P2002", Severity.ERROR),
    INVALID_CONTEXT("P2003", Severity.ERROR),
    UNKNOWN_GRAMMAR_KIND("P3001", Severity.WARNING),
    UNEXPECTED_NODE("P3002", Severity.WARNING);

    private final String code;
    private final Severity defaultSeverity;

    DiagnosticCode(String code, Severity defaultSeverity) {
        this.code = code;
        this.defaultSeverity = defaultSeverity;
    }

    public String getCode() {
        return code;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
