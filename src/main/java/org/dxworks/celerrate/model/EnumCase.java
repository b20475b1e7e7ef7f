package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class EnumCase extends Declaration {
    public final String name;
    public final List<String> annotations;
    public final Expression value;

    public EnumCase(Span span, String name, List<String> annotations, Expression value) {
        super(span);
        this.name = name;
        this.annotations = List.copyOf(annotations);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ENUM_CASE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("annotations", annotations);
        shape.child("value", value);
    }
}
