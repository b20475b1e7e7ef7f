package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Named or anonymous class. An anonymous class has no name and spans its member list only, so
 * that the constructor arguments stay siblings of it inside the {@link NewExpression}.
 */
public final class ClassDeclaration extends Declaration {
    public final String name;
    public final boolean isAbstract;
    public final boolean isFinal;
    public final boolean isReadonly;
    public final String extendsName;
    public final List<String> implementsNames;
    public final List<String> annotations;
    public final List<Declaration> members;

    public ClassDeclaration(Span span, String name, boolean isAbstract, boolean isFinal,
            boolean isReadonly, String extendsName, List<String> implementsNames,
            List<String> annotations, List<Declaration> members) {
        super(span);
        this.name = name;
        this.isAbstract = isAbstract;
        this.isFinal = isFinal;
        this.isReadonly = isReadonly;
        this.extendsName = extendsName;
        this.implementsNames = List.copyOf(implementsNames);
        this.annotations = List.copyOf(annotations);
        this.members = List.copyOf(members);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("abstract", isAbstract);
        shape.attribute("final", isFinal);
        shape.attribute("readonly", isReadonly);
        shape.attribute("extends", extendsName);
        shape.attribute("implements", implementsNames);
        shape.attribute("annotations", annotations);
        shape.children("members", members);
    }
}
