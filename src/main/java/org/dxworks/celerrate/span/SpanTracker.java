package org.dxworks.celerrate.span;

import org.dxworks.celerrate.diagnostics.InvariantViolationException;

import java.util.Arrays;

/**
 * Resolves byte ranges reported by the grammar engine into {@link Span}s.
 * <p>
 * Line starts are indexed once per buffer; each lookup is a binary search over that
 * index followed by a subtraction, so resolving a span allocates nothing but the result.
 * Recognised line terminators are {@code \n}, {@code \r\n} and a lone {@code \r}.
 */
public final class SpanTracker {
    private final int length;
    private final int[] lineStarts;

    public SpanTracker(byte[] source) {
        this.length = source.length;
        this.lineStarts = indexLineStarts(source);
    }

    private static int[] indexLineStarts(byte[] source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length; i++) {
            byte b = source[i];
            boolean terminator = b == '\n' || (b == '\r' && (i + 1 >= source.length || source[i + 1] != '\n'));
            if (terminator) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public int getSourceLength() {
        return length;
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public Span span(int startByte, int endByte) {
        if (startByte > endByte) {
            throw new InvariantViolationException("Inverted byte range [" + startByte + "," + endByte + ")");
        }
        return new Span(position(startByte), position(endByte));
    }

    public Position position(int offset) {
        if (offset < 0 || offset > length) {
            throw new InvariantViolationException("Byte offset " + offset + " outside source of length " + length);
        }
        int line = lineIndexOf(offset);
        return new Position(offset, line + 1, offset - lineStarts[line] + 1);
    }

    private int lineIndexOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
