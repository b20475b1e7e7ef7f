package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class InterfaceDeclaration extends Declaration {
    public final String name;
    public final List<String> extendsNames;
    public final List<String> annotations;
    public final List<Declaration> members;

    public InterfaceDeclaration(Span span, String name, List<String> extendsNames,
            List<String> annotations, List<Declaration> members) {
        super(span);
        this.name = name;
        this.extendsNames = List.copyOf(extendsNames);
        this.annotations = List.copyOf(annotations);
        this.members = List.copyOf(members);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTERFACE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("extends", extendsNames);
        shape.attribute("annotations", annotations);
        shape.children("members", members);
    }
}
