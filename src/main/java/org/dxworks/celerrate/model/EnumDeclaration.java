package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class EnumDeclaration extends Declaration {
    public final String name;
    public final TypeHint backingType;
    public final List<String> implementsNames;
    public final List<String> annotations;
    public final List<Declaration> members;

    public EnumDeclaration(Span span, String name, TypeHint backingType, List<String> implementsNames,
            List<String> annotations, List<Declaration> members) {
        super(span);
        this.name = name;
        this.backingType = backingType;
        this.implementsNames = List.copyOf(implementsNames);
        this.annotations = List.copyOf(annotations);
        this.members = List.copyOf(members);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ENUM;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("backingType", backingType);
        shape.attribute("implements", implementsNames);
        shape.attribute("annotations", annotations);
        shape.children("members", members);
    }
}
