package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Match arm; the default arm has no conditions.
 */
public final class MatchArm extends Clause {
    public final boolean isDefault;
    public final List<Expression> conditions;
    public final Expression body;

    public MatchArm(Span span, boolean isDefault, List<Expression> conditions, Expression body) {
        super(span);
        this.isDefault = isDefault;
        this.conditions = List.copyOf(conditions);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MATCH_ARM;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("default", isDefault);
        shape.children("conditions", conditions);
        shape.child("body", body);
    }
}
