package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class SwitchStatement extends Statement {
    public final Expression subject;
    public final List<SwitchCase> cases;
    /**
     * Broken entries between the cases, listed with them in source order.
     */
    public final List<UnknownStatement> malformed;

    public SwitchStatement(Span span, Expression subject, List<SwitchCase> cases) {
        this(span, subject, cases, List.of());
    }

    public SwitchStatement(Span span, Expression subject, List<SwitchCase> cases, List<UnknownStatement> malformed) {
        super(span);
        this.subject = subject;
        this.cases = List.copyOf(cases);
        this.malformed = List.copyOf(malformed);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SWITCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("subject", subject);
        shape.children("cases", NodeShape.inSourceOrder(cases, malformed));
    }
}
