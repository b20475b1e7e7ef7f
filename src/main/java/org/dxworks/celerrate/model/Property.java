package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Class property. A promoted property is synthesized from a constructor parameter; it has a
 * zero-width span at the parameter's visibility modifier and never carries a default value.
 */
public final class Property extends Declaration {
    public final String name;
    public final Visibility visibility;
    public final boolean isStatic;
    public final boolean isReadonly;
    public final TypeHint type;
    public final boolean promoted;
    public final List<String> annotations;
    public final Expression defaultValue;

    public Property(Span span, String name, Visibility visibility, boolean isStatic, boolean isReadonly,
            TypeHint type, boolean promoted, List<String> annotations, Expression defaultValue) {
        super(span);
        this.name = name;
        this.visibility = visibility;
        this.isStatic = isStatic;
        this.isReadonly = isReadonly;
        this.type = type;
        this.promoted = promoted;
        this.annotations = List.copyOf(annotations);
        this.defaultValue = defaultValue;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROPERTY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("visibility", visibility);
        shape.attribute("static", isStatic);
        shape.attribute("readonly", isReadonly);
        shape.attribute("type", type);
        shape.attribute("promoted", promoted);
        shape.attribute("annotations", annotations);
        shape.child("defaultValue", defaultValue);
    }
}
