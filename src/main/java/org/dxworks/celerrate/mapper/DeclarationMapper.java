package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.GrammarKind;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.dialect.GateDecision;
import org.dxworks.celerrate.model.*;
import org.dxworks.celerrate.span.Span;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.celerrate.cst.ConcreteNodeHelper.*;

/**
 * Declaration rules: namespaces, imports, class-likes, members, functions and parameters.
 */
final class DeclarationMapper {
    private static final String CONSTRUCTOR = "__construct";

    private final MappingPass pass;
    private final MappingContext context;

    DeclarationMapper(MappingPass pass) {
        this.pass = pass;
        this.context = pass.context;
    }

    /**
     * Maps a declaration found in statement position. A constant declaration with several
     * elements adds one node per element.
     */
    void mapTopLevel(ConcreteNode node, List<AstNode> out) {
        switch (node.grammarKind()) {
            case NAMESPACE_DEFINITION:
                out.add(namespace(node));
                break;
            case NAMESPACE_USE_DECLARATION:
                out.add(useDeclaration(node));
                break;
            case CLASS_DECLARATION:
                out.add(classDeclaration(node));
                break;
            case INTERFACE_DECLARATION:
                out.add(interfaceDeclaration(node));
                break;
            case TRAIT_DECLARATION:
                out.add(traitDeclaration(node));
                break;
            case ENUM_DECLARATION:
                out.add(enumDeclaration(node));
                break;
            case FUNCTION_DEFINITION:
                out.add(function(node));
                break;
            case CONST_DECLARATION:
                out.addAll(constants(node));
                break;
            default:
                out.add(context.unknownDeclaration(node, "a declaration"));
        }
    }

    // Namespaces and imports

    private Declaration namespace(ConcreteNode node) {
        ConcreteNode name = fieldOrKind(node, "name", "namespace_name");
        ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
        List<AstNode> statements = body == null ? List.of() : pass.statements.statements(significantChildren(body));
        return new NamespaceDeclaration(context.span(node), name == null ? null : qualified(name), statements);
    }

    private Declaration useDeclaration(ConcreteNode node) {
        String importKind = importKind(node, "class");
        List<UseItem> items = new ArrayList<>();
        ConcreteNode group = findFirstChild(node, "namespace_use_group");
        if (group != null) {
            ConcreteNode prefixNode = getFirstChildOfKinds(node, "namespace_name", "qualified_name", "name");
            String prefix = prefixNode == null ? "" : qualified(prefixNode) + "\\";
            for (ConcreteNode clause : significantChildren(group)) {
                if (isKindOneOf(clause.kind(), "namespace_use_group_clause", "namespace_use_clause")) {
                    items.add(useItem(clause, prefix));
                }
            }
        } else {
            for (ConcreteNode clause : findAllChildren(node, "namespace_use_clause")) {
                items.add(useItem(clause, ""));
            }
        }
        return new UseDeclaration(context.span(node), importKind, items);
    }

    private String importKind(ConcreteNode node, String fallback) {
        if (hasToken(node, "function")) return "function";
        if (hasToken(node, "const")) return "const";
        return fallback;
    }

    private UseItem useItem(ConcreteNode clause, String prefix) {
        ConcreteNode alias = clause.field("alias").orElse(null);
        ConcreteNode aliasing = findFirstChild(clause, "namespace_aliasing_clause");
        if (alias == null && aliasing != null) {
            alias = findFirstChild(aliasing, "name");
        }
        ConcreteNode name = null;
        for (ConcreteNode child : significantChildren(clause)) {
            if (child != alias && isKindOneOf(child.kind(), "name", "qualified_name", "namespace_name")) {
                name = child;
                break;
            }
        }
        String fullName = name == null ? null : prefix + qualified(name);
        return new UseItem(context.span(clause), fullName, alias == null ? null : context.text(alias).trim());
    }

    // Class-likes

    private Declaration classDeclaration(ConcreteNode node) {
        ModifierReader modifiers = ModifierReader.read(node);
        boolean readonly = modifiers.readonlyModifier != null
                && context.gate(Construct.READONLY_CLASS, modifiers.readonlyModifier).keepsConstruct();
        List<String> annotations = ModifierReader.annotations(node, context);
        String extendsName = baseNames(node).stream().findFirst().orElse(null);
        List<String> implementsNames = interfaceNames(node);
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        ConcreteNode body = fieldOrKind(node, "body", "declaration_list");
        List<Declaration> members = members(body, new DeclarationScope(DeclarationScope.Kind.CLASS, readonly));
        return new ClassDeclaration(context.span(node), name == null ? null : context.text(name).trim(),
                modifiers.abstractModifier != null, modifiers.finalModifier != null, readonly,
                extendsName, implementsNames, annotations, members);
    }

    /**
     * Anonymous class of a {@code new} expression. It spans its member list so that the
     * constructor arguments written before the body do not overlap it.
     */
    AstNode anonymousClass(ConcreteNode node) {
        ConcreteNode body = fieldOrKind(node, "body", "declaration_list");
        if (body == null) {
            return context.unknownDeclaration(node, "an anonymous class body");
        }
        ModifierReader modifiers = ModifierReader.read(node);
        boolean readonly = modifiers.readonlyModifier != null
                && context.gate(Construct.READONLY_CLASS, modifiers.readonlyModifier).keepsConstruct();
        List<String> annotations = ModifierReader.annotations(node, context);
        List<Declaration> members = members(body, new DeclarationScope(DeclarationScope.Kind.CLASS, readonly));
        return new ClassDeclaration(context.span(body), null, false, modifiers.finalModifier != null, readonly,
                baseNames(node).stream().findFirst().orElse(null), interfaceNames(node), annotations, members);
    }

    private Declaration interfaceDeclaration(ConcreteNode node) {
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        List<String> annotations = ModifierReader.annotations(node, context);
        ConcreteNode body = fieldOrKind(node, "body", "declaration_list");
        List<Declaration> members = members(body, DeclarationScope.of(DeclarationScope.Kind.INTERFACE));
        return new InterfaceDeclaration(context.span(node), name == null ? null : context.text(name).trim(),
                baseNames(node), annotations, members);
    }

    private Declaration traitDeclaration(ConcreteNode node) {
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        List<String> annotations = ModifierReader.annotations(node, context);
        ConcreteNode body = fieldOrKind(node, "body", "declaration_list");
        List<Declaration> members = members(body, DeclarationScope.of(DeclarationScope.Kind.TRAIT));
        return new TraitDeclaration(context.span(node), name == null ? null : context.text(name).trim(),
                annotations, members);
    }

    private Declaration enumDeclaration(ConcreteNode node) {
        if (!context.gate(Construct.ENUM, node).keepsConstruct()) {
            return context.rejectedDeclaration(node, Construct.ENUM);
        }
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        List<String> annotations = ModifierReader.annotations(node, context);
        TypeHint backingType = null;
        ConcreteNode colon = findToken(node, ":");
        if (colon != null) {
            for (ConcreteNode child : significantChildren(node)) {
                if (child.startByte() >= colon.endByte()) {
                    backingType = pass.types.map(child);
                    break;
                }
            }
        }
        ConcreteNode body = fieldOrKind(node, "body", "enum_declaration_list");
        List<Declaration> members = members(body, DeclarationScope.of(DeclarationScope.Kind.ENUM));
        return new EnumDeclaration(context.span(node), name == null ? null : context.text(name).trim(),
                backingType, interfaceNames(node), annotations, members);
    }

    private List<String> baseNames(ConcreteNode node) {
        return namesIn(findFirstChild(node, "base_clause"));
    }

    private List<String> interfaceNames(ConcreteNode node) {
        return namesIn(findFirstChild(node, "class_interface_clause"));
    }

    private List<String> namesIn(ConcreteNode clause) {
        List<String> names = new ArrayList<>();
        if (clause == null) return names;
        for (ConcreteNode child : significantChildren(clause)) {
            if (isKindOneOf(child.kind(), "name", "qualified_name", "named_type")) {
                names.add(qualified(child));
            }
        }
        return names;
    }

    // Members

    private List<Declaration> members(ConcreteNode body, DeclarationScope scope) {
        List<Declaration> members = new ArrayList<>();
        if (body == null) return members;
        context.enterScope(scope);
        try {
            for (ConcreteNode member : significantChildren(body)) {
                int first = members.size();
                member(member, members);
                List<Declaration> mapped = members.subList(first, members.size());
                if (context.hidesSyntaxError(member, mapped)) {
                    mapped.clear();
                    members.add(context.malformedDeclaration(member));
                }
            }
        } finally {
            context.exitScope();
        }
        return members;
    }

    private void member(ConcreteNode node, List<Declaration> out) {
        if (node.isError() || node.isMissing()) {
            out.add(context.unknownDeclaration(node, "a class member"));
            return;
        }
        switch (node.grammarKind()) {
            case PROPERTY_DECLARATION:
                out.addAll(properties(node));
                break;
            case METHOD_DECLARATION: {
                List<Property> promoted = new ArrayList<>();
                out.add(method(node, promoted));
                out.addAll(promoted);
                break;
            }
            case CONST_DECLARATION:
                out.addAll(constants(node));
                break;
            case USE_DECLARATION:
                out.add(traitUse(node));
                break;
            case ENUM_CASE:
                out.add(enumCase(node));
                break;
            default:
                out.add(context.unknownDeclaration(node, "a class member"));
        }
    }

    private List<Declaration> properties(ConcreteNode node) {
        ModifierReader modifiers = ModifierReader.read(node);
        Visibility visibility = modifiers.visibility(context, Visibility.PUBLIC);
        boolean isStatic = modifiers.staticModifier != null;
        boolean readonly = false;
        if (modifiers.readonlyModifier != null) {
            readonly = context.gate(Construct.READONLY_PROPERTY, modifiers.readonlyModifier).keepsConstruct();
        } else if (context.scope().isReadonlyClass() && !isStatic) {
            readonly = true;
        }
        ConcreteNode typeNode = node.field("type").orElse(null);
        TypeHint type = null;
        if (typeNode != null && context.gate(Construct.TYPED_PROPERTY, typeNode).keepsConstruct()) {
            type = pass.types.map(typeNode);
        }
        List<String> annotations = ModifierReader.annotations(node, context);
        List<ConcreteNode> elements = findAllChildren(node, "property_element");
        List<Declaration> result = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            ConcreteNode element = elements.get(i);
            ConcreteNode name = fieldOrKind(element, "name", "variable_name");
            Expression defaultValue = pass.expressions.mapInitializer(propertyDefault(element, name));
            result.add(new Property(elementSpan(node, elements, i), variableName(name), visibility, isStatic,
                    readonly, type, false, annotations, defaultValue));
        }
        if (result.isEmpty()) {
            result.add(context.unknownDeclaration(node, "a property element"));
        }
        return result;
    }

    private ConcreteNode propertyDefault(ConcreteNode element, ConcreteNode name) {
        ConcreteNode value = element.field("default_value").orElse(null);
        if (value != null) return value;
        ConcreteNode initializer = findFirstChild(element, "property_initializer");
        if (initializer != null) {
            List<ConcreteNode> parts = significantChildren(initializer);
            return parts.isEmpty() ? null : parts.get(0);
        }
        for (ConcreteNode child : significantChildren(element)) {
            if (child != name) return child;
        }
        return null;
    }

    /**
     * Span of one element of a multi-element declaration. The first element takes the
     * leading modifiers and the last takes the terminator, so each concrete byte belongs to
     * exactly one element.
     */
    private Span elementSpan(ConcreteNode declaration, List<ConcreteNode> elements, int index) {
        if (elements.size() == 1) {
            return context.span(declaration);
        }
        ConcreteNode element = elements.get(index);
        int start = index == 0 ? declaration.startByte() : element.startByte();
        int end = index == elements.size() - 1 ? declaration.endByte() : element.endByte();
        return context.span(start, end);
    }

    private Declaration method(ConcreteNode node, List<Property> promotedOut) {
        ModifierReader modifiers = ModifierReader.read(node);
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        String methodName = name == null ? null : context.text(name).trim();
        boolean constructor = CONSTRUCTOR.equalsIgnoreCase(methodName);
        Visibility visibility = modifiers.visibility(context, Visibility.PUBLIC);
        List<String> annotations = ModifierReader.annotations(node, context);
        boolean byRef = findFirstChild(node, "reference_modifier") != null;
        boolean readonlyClass = context.scope().isReadonlyClass();
        context.enterScope(new DeclarationScope(constructor ? DeclarationScope.Kind.CONSTRUCTOR
                : DeclarationScope.Kind.METHOD, readonlyClass));
        try {
            List<Declaration> parameters = parameters(fieldOrKind(node, "parameters", "formal_parameters"), promotedOut);
            TypeHint returnType = pass.types.mapReturnType(node.field("return_type").orElse(null));
            ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
            return new MethodDeclaration(context.span(node), methodName, visibility,
                    modifiers.staticModifier != null, modifiers.abstractModifier != null,
                    modifiers.finalModifier != null, byRef, returnType, annotations, parameters,
                    body == null ? null : pass.statements.block(body));
        } finally {
            context.exitScope();
        }
    }

    private Declaration function(ConcreteNode node) {
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        List<String> annotations = ModifierReader.annotations(node, context);
        boolean byRef = findFirstChild(node, "reference_modifier") != null;
        context.enterScope(DeclarationScope.of(DeclarationScope.Kind.FUNCTION));
        try {
            List<Declaration> parameters = parameters(fieldOrKind(node, "parameters", "formal_parameters"));
            TypeHint returnType = pass.types.mapReturnType(node.field("return_type").orElse(null));
            ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
            Block block = body == null ? new Block(context.span(node.endByte(), node.endByte()), List.of())
                    : pass.statements.block(body);
            return new FunctionDeclaration(context.span(node), name == null ? null : context.text(name).trim(),
                    byRef, returnType, annotations, parameters, block);
        } finally {
            context.exitScope();
        }
    }

    private List<Declaration> constants(ConcreteNode node) {
        ModifierReader modifiers = ModifierReader.read(node);
        boolean classLike = context.scope().isClassLike();
        Visibility visibility = null;
        if (classLike) {
            visibility = Visibility.PUBLIC;
            if (modifiers.visibility != null
                    && context.gate(Construct.CLASS_CONSTANT_VISIBILITY, modifiers.visibility).keepsConstruct()) {
                visibility = modifiers.visibility(context, Visibility.PUBLIC);
            }
            if (context.scope().getKind() == DeclarationScope.Kind.TRAIT) {
                context.gate(Construct.TRAIT_CONSTANT, node);
            }
        } else if (modifiers.visibility != null) {
            context.invalidContext(modifiers.visibility, "Visibility on a constant outside a class");
        }
        boolean isFinal = modifiers.finalModifier != null
                && context.gate(Construct.FINAL_CLASS_CONSTANT, modifiers.finalModifier).keepsConstruct();
        ConcreteNode typeNode = node.field("type").orElse(null);
        TypeHint type = null;
        if (typeNode != null && context.gate(Construct.TYPED_CLASS_CONSTANT, typeNode).keepsConstruct()) {
            type = pass.types.map(typeNode);
        }
        List<String> annotations = ModifierReader.annotations(node, context);
        List<ConcreteNode> elements = findAllChildren(node, "const_element");
        List<Declaration> result = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            ConcreteNode element = elements.get(i);
            List<ConcreteNode> parts = significantChildren(element);
            ConcreteNode name = getFirstChildOfKinds(element, "name");
            ConcreteNode value = parts.isEmpty() || parts.get(parts.size() - 1) == name ? null : parts.get(parts.size() - 1);
            Expression mapped = value == null
                    ? context.unknownExpression(element, "a constant value")
                    : pass.expressions.mapInitializer(value);
            result.add(new ConstantDeclaration(elementSpan(node, elements, i),
                    name == null ? null : context.text(name).trim(), visibility, isFinal, type, annotations, mapped));
        }
        if (result.isEmpty()) {
            result.add(context.unknownDeclaration(node, "a constant element"));
        }
        return result;
    }

    private Declaration traitUse(ConcreteNode node) {
        List<String> traits = new ArrayList<>();
        for (ConcreteNode child : significantChildren(node)) {
            if (isKindOneOf(child.kind(), "name", "qualified_name")) {
                traits.add(qualified(child));
            }
        }
        return new TraitUse(context.span(node), traits);
    }

    private Declaration enumCase(ConcreteNode node) {
        ConcreteNode name = node.field("name").orElse(findFirstChild(node, "name"));
        List<String> annotations = ModifierReader.annotations(node, context);
        ConcreteNode value = node.field("value").orElse(null);
        if (value == null) {
            for (ConcreteNode child : significantChildren(node)) {
                if (child != name && child.grammarKind() != GrammarKind.ATTRIBUTE_LIST) value = child;
            }
        }
        return new EnumCase(context.span(node), name == null ? null : context.text(name).trim(), annotations,
                value == null ? null : pass.expressions.map(value));
    }

    // Parameters

    /**
     * Parameters of a function-like. Promoted parameters outside a constructor are reported
     * and mapped as plain parameters.
     */
    List<Declaration> parameters(ConcreteNode node) {
        return parameters(node, new ArrayList<>());
    }

    List<Declaration> parameters(ConcreteNode node, List<Property> promotedOut) {
        List<Declaration> result = new ArrayList<>();
        if (node == null) return result;
        for (ConcreteNode child : significantChildren(node)) {
            if (child.isError() || child.isMissing()) {
                result.add(context.unknownDeclaration(child, "a parameter"));
                continue;
            }
            switch (child.grammarKind()) {
                case SIMPLE_PARAMETER:
                case VARIADIC_PARAMETER:
                case PROPERTY_PROMOTION_PARAMETER:
                    result.add(parameter(child, promotedOut));
                    break;
                default:
                    result.add(context.unknownDeclaration(child, "a parameter"));
            }
        }
        return result;
    }

    private Declaration parameter(ConcreteNode node, List<Property> promotedOut) {
        ModifierReader modifiers = ModifierReader.read(node);
        ConcreteNode name = fieldOrKind(node, "name", "variable_name");
        if (name == null) {
            ConcreteNode byRefNode = findFirstChild(node, "by_ref");
            name = byRefNode == null ? null : findFirstChild(byRefNode, "variable_name");
        }
        if (name == null) {
            return context.unknownDeclaration(node, "a parameter name");
        }
        String parameterName = variableName(name);
        TypeHint type = pass.types.map(node.field("type").orElse(null));
        boolean byRef = findFirstChild(node, "reference_modifier") != null || findFirstChild(node, "by_ref") != null;
        boolean variadic = node.grammarKind() == GrammarKind.VARIADIC_PARAMETER || hasToken(node, "...");
        List<String> annotations = ModifierReader.annotations(node, context);
        ConcreteNode defaultNode = node.field("default_value").orElse(null);
        Expression defaultValue = defaultNode == null ? null : pass.expressions.mapInitializer(defaultNode);

        boolean promotion = modifiers.visibility != null || modifiers.readonlyModifier != null;
        if (!promotion) {
            return new Parameter(context.span(node), parameterName, type, byRef, variadic, null, false,
                    annotations, defaultValue);
        }
        ConcreteNode firstModifier = earliest(modifiers.visibility, modifiers.readonlyModifier);
        if (context.scope().getKind() != DeclarationScope.Kind.CONSTRUCTOR) {
            context.invalidContext(firstModifier, "Property promotion outside a constructor");
            return new Parameter(context.span(node), parameterName, type, byRef, variadic, null, false,
                    annotations, defaultValue);
        }
        GateDecision promotionDecision = context.gate(Construct.CONSTRUCTOR_PROMOTION, firstModifier);
        if (!promotionDecision.keepsConstruct()) {
            return new Parameter(context.span(node), parameterName, type, byRef, variadic, null, false,
                    annotations, defaultValue);
        }
        Visibility visibility = modifiers.visibility(context, Visibility.PUBLIC);
        boolean readonly;
        if (modifiers.readonlyModifier != null) {
            // One gate covers both the parameter and the synthesized property
            readonly = context.gate(Construct.READONLY_PROPERTY, modifiers.readonlyModifier).keepsConstruct();
        } else {
            readonly = context.scope().isReadonlyClass();
        }
        promotedOut.add(new Property(context.zeroWidthAt(firstModifier), parameterName, visibility, false,
                readonly, type, true, annotations, null));
        return new Parameter(context.span(node), parameterName, type, byRef, variadic, visibility, readonly,
                annotations, defaultValue);
    }

    private static ConcreteNode earliest(ConcreteNode first, ConcreteNode second) {
        if (first == null) return second;
        if (second == null) return first;
        return first.startByte() <= second.startByte() ? first : second;
    }

    private String variableName(ConcreteNode name) {
        if (name == null) return null;
        String text = context.text(name).trim();
        return text.startsWith("$") ? text.substring(1) : text;
    }

    private String qualified(ConcreteNode name) {
        String text = normalizeInline(context.text(name)).replace(" ", "");
        return text.startsWith("\\") ? text.substring(1) : text;
    }
}
