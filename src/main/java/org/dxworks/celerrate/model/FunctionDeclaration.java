package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class FunctionDeclaration extends Declaration {
    public final String name;
    public final boolean byRef;
    public final TypeHint returnType;
    public final List<String> annotations;
    public final List<Declaration> parameters;
    public final Block body;

    public FunctionDeclaration(Span span, String name, boolean byRef, TypeHint returnType,
            List<String> annotations, List<Declaration> parameters, Block body) {
        super(span);
        this.name = name;
        this.byRef = byRef;
        this.returnType = returnType;
        this.annotations = List.copyOf(annotations);
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("byRef", byRef);
        shape.attribute("returnType", returnType);
        shape.attribute("annotations", annotations);
        shape.children("parameters", parameters);
        shape.child("body", body);
    }
}
