package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Decoded string value; quoting style is not kept.
 */
public final class StringLiteral extends Expression {
    public final String value;

    public StringLiteral(Span span, String value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRING;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("value", value);
    }
}
