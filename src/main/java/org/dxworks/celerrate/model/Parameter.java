package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Function, method, closure or arrow function parameter. {@code promotedVisibility} is set only for
 * constructor parameters that also declare a property.
 */
public final class Parameter extends Declaration {
    public final String name;
    public final TypeHint type;
    public final boolean byRef;
    public final boolean variadic;
    public final Visibility promotedVisibility;
    public final boolean isReadonly;
    public final List<String> annotations;
    public final Expression defaultValue;

    public Parameter(Span span, String name, TypeHint type, boolean byRef, boolean variadic,
            Visibility promotedVisibility, boolean isReadonly, List<String> annotations,
            Expression defaultValue) {
        super(span);
        this.name = name;
        this.type = type;
        this.byRef = byRef;
        this.variadic = variadic;
        this.promotedVisibility = promotedVisibility;
        this.isReadonly = isReadonly;
        this.annotations = List.copyOf(annotations);
        this.defaultValue = defaultValue;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARAMETER;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("type", type);
        shape.attribute("byRef", byRef);
        shape.attribute("variadic", variadic);
        shape.attribute("promotedVisibility", promotedVisibility);
        shape.attribute("readonly", isReadonly);
        shape.attribute("annotations", annotations);
        shape.child("defaultValue", defaultValue);
    }
}
