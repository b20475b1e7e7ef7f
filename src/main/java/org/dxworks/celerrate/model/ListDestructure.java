package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Destructuring target, from {@code list(...)} or a short {@code [...]} on the left of an assignment.
 */
public final class ListDestructure extends Expression {
    public final List<ArrayElement> elements;
    /**
     * Source spelling kept when destructuring is read as written:
     * {@code "list"} or {@code "short"}. {@code null} under the canonical reading.
     */
    public final String spelling;

    public ListDestructure(Span span, List<ArrayElement> elements) {
        this(span, elements, null);
    }

    public ListDestructure(Span span, List<ArrayElement> elements, String spelling) {
        super(span);
        this.elements = List.copyOf(elements);
        this.spelling = spelling;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("spelling", spelling);
        shape.children("elements", elements);
    }
}
