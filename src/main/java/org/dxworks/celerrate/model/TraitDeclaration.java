package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class TraitDeclaration extends Declaration {
    public final String name;
    public final List<String> annotations;
    public final List<Declaration> members;

    public TraitDeclaration(Span span, String name, List<String> annotations, List<Declaration> members) {
        super(span);
        this.name = name;
        this.annotations = List.copyOf(annotations);
        this.members = List.copyOf(members);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRAIT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("annotations", annotations);
        shape.children("members", members);
    }
}
