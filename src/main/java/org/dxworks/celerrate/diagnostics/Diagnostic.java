package org.dxworks.celerrate.diagnostics;

import org.dxworks.celerrate.span.Span;

import java.util.Objects;

/**
 * A recoverable issue found while mapping, anchored to a source span rather than to a node.
 */
public final class Diagnostic {
    private final Severity severity;
    private final DiagnosticCode code;
    private final Span span;
    private final String message;

    public Diagnostic(Severity severity, DiagnosticCode code, Span span, String message) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.code = Objects.requireNonNull(code, "code");
        this.span = Objects.requireNonNull(span, "span");
        this.message = Objects.requireNonNull(message, "message");
    }

    public Severity getSeverity() {
        return severity;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public Span getSpan() {
        return span;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic other = (Diagnostic) o;
        return severity == other.severity && code == other.code
                && span.equals(other.span) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, code, span, message);
    }

    @Override
    public String toString() {
        return severity.getName() + "[" + code.getCode() + "] " + span.getStart() + ": " + message;
    }
}
