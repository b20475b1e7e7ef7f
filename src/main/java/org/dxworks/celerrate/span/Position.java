package org.dxworks.celerrate.span;

import java.util.Objects;

/**
 * A point in the source buffer: zero-based byte offset plus 1-based line and column.
 * Columns are counted in bytes from the start of the line.
 */
public final class Position {
    private final int offset;
    private final int line;
    private final int column;

    public Position(int offset, int line, int column) {
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return offset == other.offset && line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
