package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class MatchExpression extends Expression {
    public final Expression subject;
    public final List<MatchArm> arms;
    /**
     * Broken entries between the arms, listed with them in source order.
     */
    public final List<UnknownExpression> malformed;

    public MatchExpression(Span span, Expression subject, List<MatchArm> arms) {
        this(span, subject, arms, List.of());
    }

    public MatchExpression(Span span, Expression subject, List<MatchArm> arms, List<UnknownExpression> malformed) {
        super(span);
        this.subject = subject;
        this.arms = List.copyOf(arms);
        this.malformed = List.copyOf(malformed);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MATCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("subject", subject);
        shape.children("arms", NodeShape.inSourceOrder(arms, malformed));
    }
}
