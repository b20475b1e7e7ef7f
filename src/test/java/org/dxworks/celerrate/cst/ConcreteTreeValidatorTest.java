package org.dxworks.celerrate.cst;

import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.diagnostics.DiagnosticsCollector;
import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.span.SpanTracker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.celerrate.cst.FakeConcreteNode.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConcreteTreeValidatorTest {

    private static List<Diagnostic> validate(int sourceLength, ConcreteNode root) {
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        new ConcreteTreeValidator(new SpanTracker(new byte[sourceLength]), diagnostics).validate(root);
        return diagnostics.seal();
    }

    @Test
    void validate_reportsOutermostErrorOnly() {
        FakeConcreteNode nested = node("ERROR", 3, 5);
        FakeConcreteNode root = node("program", 0, 10, node("ERROR", 2, 6, nested));

        List<Diagnostic> diagnostics = validate(10, root);

        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticCode.SYNTAX_ERROR, diagnostics.get(0).getCode());
        assertEquals(2, diagnostics.get(0).getSpan().getStartOffset());
    }

    @Test
    void validate_reportsMissingNodes() {
        FakeConcreteNode root = node("program", 0, 10,
                node("expression_statement", 0, 4, node("variable_name", 0, 4), missing(";", 4)));

        List<Diagnostic> diagnostics = validate(10, root);

        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticCode.MISSING_NODE, diagnostics.get(0).getCode());
        assertEquals("Missing ;", diagnostics.get(0).getMessage());
        assertTrue(diagnostics.get(0).getSpan().isEmpty());
    }

    @Test
    void validate_acceptsWellFormedTree() {
        FakeConcreteNode root = node("program", 0, 9, token("<?php", 0), node("text", 6, 9));

        assertTrue(validate(9, root).isEmpty());
    }

    @Test
    void validate_rejectsChildOutsideParent() {
        FakeConcreteNode root = node("program", 0, 5, node("text", 3, 8));

        assertThrows(InvariantViolationException.class, () -> validate(10, root));
    }

    @Test
    void validate_rejectsRootPastEndOfSource() {
        assertThrows(InvariantViolationException.class, () -> validate(4, node("program", 0, 5)));
    }

    @Test
    void validate_rejectsUnorderedSiblings() {
        FakeConcreteNode root = node("program", 0, 10, node("text", 5, 8), node("text", 1, 3));

        assertThrows(InvariantViolationException.class, () -> validate(10, root));
    }

    @Test
    void validate_rejectsCycles() {
        FakeConcreteNode root = node("program", 0, 10);
        FakeConcreteNode child = node("compound_statement", 0, 10);
        root.add(null, child);
        child.add(null, root);

        assertThrows(InvariantViolationException.class, () -> validate(10, root));
    }

    @Test
    void validate_handlesVeryDeepTrees() {
        FakeConcreteNode root = node("program", 0, 1);
        FakeConcreteNode current = root;
        for (int i = 0; i < 50_000; i++) {
            FakeConcreteNode next = node("parenthesized_expression", 0, 1);
            current.add(null, next);
            current = next;
        }

        assertDoesNotThrow(() -> validate(1, root));
    }
}
