package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class CatchClause extends Clause {
    public final List<String> types;
    public final String variable;
    public final Block body;

    public CatchClause(Span span, List<String> types, String variable, Block body) {
        super(span);
        this.types = List.copyOf(types);
        this.variable = variable;
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CATCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("types", types);
        shape.attribute("variable", variable);
        shape.child("body", body);
    }
}
