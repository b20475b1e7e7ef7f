package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.dialect.Ambiguity;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.dialect.InterpretationChoice;
import org.dxworks.celerrate.model.TypeHint;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.celerrate.cst.ConcreteNodeHelper.normalizeInline;
import static org.dxworks.celerrate.cst.ConcreteNodeHelper.significantChildren;

/**
 * Maps type declarations to {@link TypeHint}s and gates the type-level constructs.
 */
final class TypeMapper {
    private final MappingContext context;

    TypeMapper(MappingContext context) {
        this.context = context;
    }

    TypeHint map(ConcreteNode node) {
        return map(node, false);
    }

    TypeHint mapReturnType(ConcreteNode node) {
        return map(node, true);
    }

    private TypeHint map(ConcreteNode node, boolean returnType) {
        if (node == null) return null;
        TypeHint hint = mapType(node, returnType);
        if (hint != null && hint.getForm() == TypeHint.Form.NAMED) {
            String name = hint.getName();
            if (name.equals("null") || name.equals("false") || name.equals("true")) {
                context.gate(Construct.STANDALONE_LITERAL_TYPE, node);
            }
        }
        return hint;
    }

    private TypeHint mapType(ConcreteNode node, boolean returnType) {
        switch (node.grammarKind()) {
            case NAMED_TYPE:
            case PRIMITIVE_TYPE:
            case BOTTOM_TYPE:
            case NAME:
            case QUALIFIED_NAME:
                return named(node, returnType);
            case OPTIONAL_TYPE: {
                context.gate(Construct.NULLABLE_TYPE, node);
                List<ConcreteNode> inner = significantChildren(node);
                if (inner.isEmpty()) return TypeHint.named(normalizeInline(context.text(node)).substring(1));
                return TypeHint.nullable(mapType(inner.get(0), returnType));
            }
            case UNION_TYPE:
                return union(node, returnType);
            case INTERSECTION_TYPE:
                context.gate(Construct.INTERSECTION_TYPE, node);
                return TypeHint.intersection(members(node, returnType));
            case DISJUNCTIVE_NORMAL_FORM_TYPE:
                context.gate(Construct.DNF_TYPE, node);
                return TypeHint.union(members(node, returnType));
            default:
                // Recovered or unfamiliar type syntax keeps its text
                return TypeHint.named(normalizeInline(context.text(node)));
        }
    }

    private TypeHint union(ConcreteNode node, boolean returnType) {
        context.gate(Construct.UNION_TYPE, node);
        List<TypeHint> members = members(node, returnType);
        for (TypeHint member : members) {
            if (member.getForm() == TypeHint.Form.INTERSECTION) {
                context.gate(Construct.DNF_TYPE, node);
                break;
            }
        }
        if (members.size() == 2) {
            int nullIndex = members.indexOf(TypeHint.named("null"));
            if (nullIndex >= 0) {
                TypeHint other = members.get(1 - nullIndex);
                InterpretationChoice reading = context.getResolver()
                        .resolveAmbiguity(Ambiguity.NULLABLE_SPELLING, context.getDialect());
                if (reading == InterpretationChoice.NULLABLE_SHORTHAND && other.getForm() == TypeHint.Form.NAMED) {
                    return TypeHint.nullable(other);
                }
            }
        }
        return TypeHint.union(members);
    }

    private List<TypeHint> members(ConcreteNode node, boolean returnType) {
        List<TypeHint> members = new ArrayList<>();
        for (ConcreteNode child : significantChildren(node)) {
            members.add(mapType(child, returnType));
        }
        return members;
    }

    private TypeHint named(ConcreteNode node, boolean returnType) {
        TypeHint hint = TypeHint.named(normalizeInline(context.text(node)));
        switch (hint.getName()) {
            case "void":
                context.gate(Construct.VOID_TYPE, node);
                break;
            case "iterable":
                context.gate(Construct.ITERABLE_TYPE, node);
                break;
            case "object":
                context.gate(Construct.OBJECT_TYPE, node);
                break;
            case "mixed":
                context.gate(Construct.MIXED_TYPE, node);
                break;
            case "never":
                context.gate(Construct.NEVER_TYPE, node);
                break;
            case "static":
                if (returnType) {
                    context.gate(Construct.STATIC_RETURN_TYPE, node);
                }
                break;
            default:
                break;
        }
        return hint;
    }
}
