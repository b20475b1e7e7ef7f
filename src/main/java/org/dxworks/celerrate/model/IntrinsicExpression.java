package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Keyword construct used as an expression, such as {@code clone}, {@code print}, {@code exit}
 * or one of the {@code include}/{@code require} forms.
 */
public final class IntrinsicExpression extends Expression {
    public final String keyword;
    public final Expression operand;

    public IntrinsicExpression(Span span, String keyword, Expression operand) {
        super(span);
        this.keyword = keyword;
        this.operand = operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTRINSIC;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("keyword", keyword);
        shape.child("operand", operand);
    }
}
