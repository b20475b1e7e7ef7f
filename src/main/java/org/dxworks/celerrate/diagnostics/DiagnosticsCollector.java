package org.dxworks.celerrate.diagnostics;

import org.dxworks.celerrate.span.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only diagnostics sink for a single mapping pass. Once sealed, further reports fail.
 */
public final class DiagnosticsCollector {
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean sealed;

    public void report(Severity severity, DiagnosticCode code, Span span, String message) {
        if (sealed) {
            throw new IllegalStateException("Diagnostics collector already sealed; cannot report " + code);
        }
        diagnostics.add(new Diagnostic(severity, code, span, message));
    }

    public void report(DiagnosticCode code, Span span, String message) {
        report(code.getDefaultSeverity(), code, span, message);
    }

    public void warning(DiagnosticCode code, Span span, String message) {
        report(Severity.WARNING, code, span, message);
    }

    public void error(DiagnosticCode code, Span span, String message) {
        report(Severity.ERROR, code, span, message);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Ends the pass and hands out the collected records in report order.
     */
    public List<Diagnostic> seal() {
        sealed = true;
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
