package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Both {@code array(...)} and {@code [...]} map here.
 */
public final class ArrayLiteral extends Expression {
    public final List<ArrayElement> elements;
    /**
     * Source spelling kept when arrays are read as written:
     * {@code "array"} or {@code "short"}. {@code null} under the canonical reading.
     */
    public final String spelling;

    public ArrayLiteral(Span span, List<ArrayElement> elements) {
        this(span, elements, null);
    }

    public ArrayLiteral(Span span, List<ArrayElement> elements, String spelling) {
        super(span);
        this.elements = List.copyOf(elements);
        this.spelling = spelling;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("spelling", spelling);
        shape.children("elements", elements);
    }
}
