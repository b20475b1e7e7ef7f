package org.dxworks.celerrate.span;

import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SpanTrackerTest {

    private static SpanTracker tracker(String source) {
        return new SpanTracker(source.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void position_countsLinesAndColumnsFromOne() {
        SpanTracker tracker = tracker("<?php\n$a = 1;\n$b = 2;\n");

        Position start = tracker.position(0);
        assertEquals(1, start.getLine());
        assertEquals(1, start.getColumn());

        Position b = tracker.position(14);
        assertEquals(3, b.getLine());
        assertEquals(1, b.getColumn());

        Position semicolon = tracker.position(12);
        assertEquals(2, semicolon.getLine());
        assertEquals(7, semicolon.getColumn());
    }

    @Test
    void position_handlesAllLineTerminators() {
        SpanTracker tracker = tracker("a\r\nb\rc\nd");

        assertEquals(4, tracker.getLineCount());
        assertEquals(2, tracker.position(3).getLine());
        assertEquals(3, tracker.position(5).getLine());
        assertEquals(4, tracker.position(7).getLine());
    }

    @Test
    void position_columnsAreBytes() {
        // "é" is two bytes in UTF-8
        SpanTracker tracker = tracker("é$x");

        assertEquals(3, tracker.position(2).getColumn());
    }

    @Test
    void position_atEndOfSourceIsValid() {
        SpanTracker tracker = tracker("abc\n");

        Position end = tracker.position(4);
        assertEquals(2, end.getLine());
        assertEquals(1, end.getColumn());
    }

    @Test
    void span_rejectsInvertedAndOutOfRange() {
        SpanTracker tracker = tracker("abc");

        assertThrows(InvariantViolationException.class, () -> tracker.span(2, 1));
        assertThrows(InvariantViolationException.class, () -> tracker.span(0, 4));
        assertThrows(InvariantViolationException.class, () -> tracker.position(-1));
    }

    @Test
    void span_coverAndContainment() {
        SpanTracker tracker = tracker("0123456789");
        Span left = tracker.span(1, 3);
        Span right = tracker.span(5, 8);

        Span both = Span.cover(left, right);
        assertEquals(1, both.getStartOffset());
        assertEquals(8, both.getEndOffset());
        assertTrue(both.contains(left));
        assertTrue(both.contains(right));
        assertFalse(left.overlaps(right));
        assertFalse(tracker.span(2, 2).overlaps(left));
        assertTrue(tracker.span(2, 2).isEmpty());
    }
}
