package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Class, interface, trait or enum method. Abstract and interface methods have no body.
 */
public final class MethodDeclaration extends Declaration {
    public final String name;
    public final Visibility visibility;
    public final boolean isStatic;
    public final boolean isAbstract;
    public final boolean isFinal;
    public final boolean byRef;
    public final TypeHint returnType;
    public final List<String> annotations;
    public final List<Declaration> parameters;
    public final Block body;

    public MethodDeclaration(Span span, String name, Visibility visibility, boolean isStatic,
            boolean isAbstract, boolean isFinal, boolean byRef, TypeHint returnType,
            List<String> annotations, List<Declaration> parameters, Block body) {
        super(span);
        this.name = name;
        this.visibility = visibility;
        this.isStatic = isStatic;
        this.isAbstract = isAbstract;
        this.isFinal = isFinal;
        this.byRef = byRef;
        this.returnType = returnType;
        this.annotations = List.copyOf(annotations);
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.METHOD;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("visibility", visibility);
        shape.attribute("static", isStatic);
        shape.attribute("abstract", isAbstract);
        shape.attribute("final", isFinal);
        shape.attribute("byRef", byRef);
        shape.attribute("returnType", returnType);
        shape.attribute("annotations", annotations);
        shape.children("parameters", parameters);
        shape.child("body", body);
    }
}
