package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Global or class constant. Visibility is {@code null} for global constants.
 */
public final class ConstantDeclaration extends Declaration {
    public final String name;
    public final Visibility visibility;
    public final boolean isFinal;
    public final TypeHint type;
    public final List<String> annotations;
    public final Expression value;

    public ConstantDeclaration(Span span, String name, Visibility visibility, boolean isFinal,
            TypeHint type, List<String> annotations, Expression value) {
        super(span);
        this.name = name;
        this.visibility = visibility;
        this.isFinal = isFinal;
        this.type = type;
        this.annotations = List.copyOf(annotations);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("visibility", visibility);
        shape.attribute("final", isFinal);
        shape.attribute("type", type);
        shape.attribute("annotations", annotations);
        shape.child("value", value);
    }
}
