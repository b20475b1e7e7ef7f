package org.dxworks.celerrate.diagnostics;

import org.dxworks.celerrate.span.Position;
import org.dxworks.celerrate.span.Span;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticsCollectorTest {

    private static final Span SPAN = Span.zeroWidthAt(new Position(0, 1, 1));

    @Test
    void seal_keepsReportOrder() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.warning(DiagnosticCode.UNEXPECTED_NODE, SPAN, "first");
        collector.error(DiagnosticCode.SYNTAX_ERROR, SPAN, "second");
        collector.report(DiagnosticCode.MISSING_NODE, SPAN, "third");

        List<Diagnostic> diagnostics = collector.seal();

        assertEquals(3, diagnostics.size());
        assertEquals("first", diagnostics.get(0).getMessage());
        assertFalse(diagnostics.get(0).isError());
        assertTrue(diagnostics.get(1).isError());
        assertEquals(Severity.ERROR, diagnostics.get(2).getSeverity());
    }

    @Test
    void report_afterSealFails() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.seal();

        assertTrue(collector.isSealed());
        assertThrows(IllegalStateException.class,
                () -> collector.warning(DiagnosticCode.UNEXPECTED_NODE, SPAN, "late"));
    }

    @Test
    void seal_returnsUnmodifiableSnapshot() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.warning(DiagnosticCode.UNEXPECTED_NODE, SPAN, "only");

        List<Diagnostic> diagnostics = collector.seal();

        assertThrows(UnsupportedOperationException.class, diagnostics::clear);
    }
}
