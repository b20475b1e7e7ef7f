package org.dxworks.celerrate.span;

import java.util.Objects;

/**
 * Inclusive-exclusive byte range with resolved line/column positions for both ends.
 */
public final class Span {
    private final Position start;
    private final Position end;

    public Span(Position start, Position end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (end.getOffset() < start.getOffset()) {
            throw new IllegalArgumentException("Span end " + end.getOffset() + " precedes start " + start.getOffset());
        }
    }

    public static Span zeroWidthAt(Position position) {
        return new Span(position, position);
    }

    /**
     * Smallest span covering both arguments.
     */
    public static Span cover(Span first, Span second) {
        Position start = first.start.getOffset() <= second.start.getOffset() ? first.start : second.start;
        Position end = first.end.getOffset() >= second.end.getOffset() ? first.end : second.end;
        return new Span(start, end);
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    public int getStartOffset() {
        return start.getOffset();
    }

    public int getEndOffset() {
        return end.getOffset();
    }

    public int length() {
        return end.getOffset() - start.getOffset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public boolean contains(Span other) {
        return start.getOffset() <= other.getStartOffset() && other.getEndOffset() <= end.getOffset();
    }

    /**
     * True when the two ranges share at least one byte. Zero-width spans overlap nothing.
     */
    public boolean overlaps(Span other) {
        return Math.max(getStartOffset(), other.getStartOffset()) < Math.min(getEndOffset(), other.getEndOffset());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span other = (Span) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start.getOffset() + "," + end.getOffset() + ")@" + start + "-" + end;
    }
}
