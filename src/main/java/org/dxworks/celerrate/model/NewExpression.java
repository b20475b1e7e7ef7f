package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Object creation. The class reference is an expression, or a {@link ClassDeclaration} for an anonymous class.
 */
public final class NewExpression extends Expression {
    public final AstNode classReference;
    public final List<Argument> arguments;

    public NewExpression(Span span, AstNode classReference, List<Argument> arguments) {
        super(span);
        this.classReference = classReference;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NEW;
    }

    @Override
    protected void describe(NodeShape shape) {
        if (classReference instanceof ClassDeclaration) {
            // An anonymous class body follows its constructor arguments
            shape.children("arguments", arguments);
            shape.child("class", classReference);
        } else {
            shape.child("class", classReference);
            shape.children("arguments", arguments);
        }
    }
}
