package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class ArrowFunction extends Expression {
    public final boolean isStatic;
    public final boolean byRef;
    public final TypeHint returnType;
    public final List<Declaration> parameters;
    public final Expression body;

    public ArrowFunction(Span span, boolean isStatic, boolean byRef, TypeHint returnType,
            List<Declaration> parameters, Expression body) {
        super(span);
        this.isStatic = isStatic;
        this.byRef = byRef;
        this.returnType = returnType;
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARROW_FUNCTION;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("static", isStatic);
        shape.attribute("byRef", byRef);
        shape.attribute("returnType", returnType);
        shape.children("parameters", parameters);
        shape.child("body", body);
    }
}
