package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class StaticVariableStatement extends Statement {
    public final List<StaticVariable> variables;

    public StaticVariableStatement(Span span, List<StaticVariable> variables) {
        super(span);
        this.variables = List.copyOf(variables);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATIC_VARIABLES;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("variables", variables);
    }
}
