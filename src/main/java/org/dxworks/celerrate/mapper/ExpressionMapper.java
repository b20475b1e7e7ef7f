package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.GrammarKind;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.dialect.Ambiguity;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.InterpretationChoice;
import org.dxworks.celerrate.model.*;
import org.dxworks.celerrate.span.Span;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.dxworks.celerrate.cst.ConcreteNodeHelper.*;

/**
 * Expression rules. Every expression-position node goes through {@link #map(ConcreteNode)}.
 */
final class ExpressionMapper {
    private final MappingPass pass;
    private final MappingContext context;

    ExpressionMapper(MappingPass pass) {
        this.pass = pass;
        this.context = pass.context;
    }

    Expression map(ConcreteNode node) {
        if (node.isError() || node.isMissing()) {
            return context.unknownExpression(node, "an expression");
        }
        switch (node.grammarKind()) {
            case PARENTHESIZED_EXPRESSION:
                return parenthesized(node);
            case VARIABLE_NAME:
                return variable(node);
            case DYNAMIC_VARIABLE_NAME:
                return dynamicVariable(node);
            case NAME:
            case QUALIFIED_NAME:
            case NAMESPACE_NAME:
            case RELATIVE_SCOPE:
                return nameReference(node);
            case INTEGER:
                return integer(node);
            case FLOAT:
                return floating(node);
            case STRING:
                return singleQuoted(node);
            case ENCAPSED_STRING:
                return interpolated(node, node);
            case HEREDOC:
                return heredoc(node);
            case NOWDOC:
                return nowdoc(node);
            case BOOLEAN:
                return new BooleanLiteral(context.span(node), context.text(node).trim().equalsIgnoreCase("true"));
            case NULL:
                return new NullLiteral(context.span(node));
            case ASSIGNMENT_EXPRESSION:
            case REFERENCE_ASSIGNMENT_EXPRESSION:
            case AUGMENTED_ASSIGNMENT_EXPRESSION:
                return assignment(node);
            case BINARY_EXPRESSION:
                return binary(node);
            case UNARY_OP_EXPRESSION:
            case ERROR_SUPPRESSION_EXPRESSION:
                return unary(node);
            case UPDATE_EXPRESSION:
                return update(node);
            case CAST_EXPRESSION:
                return cast(node);
            case CONDITIONAL_EXPRESSION:
                return conditional(node);
            case FUNCTION_CALL_EXPRESSION:
                return functionCall(node);
            case MEMBER_CALL_EXPRESSION:
            case NULLSAFE_MEMBER_CALL_EXPRESSION:
                return methodCall(node);
            case SCOPED_CALL_EXPRESSION:
                return staticCall(node);
            case MEMBER_ACCESS_EXPRESSION:
            case NULLSAFE_MEMBER_ACCESS_EXPRESSION:
                return propertyFetch(node);
            case SCOPED_PROPERTY_ACCESS_EXPRESSION:
                return staticPropertyFetch(node);
            case CLASS_CONSTANT_ACCESS_EXPRESSION:
                return classConstantFetch(node);
            case SUBSCRIPT_EXPRESSION:
                return arrayAccess(node);
            case OBJECT_CREATION_EXPRESSION:
                return objectCreation(node);
            case ANONYMOUS_FUNCTION:
            case ANONYMOUS_FUNCTION_CREATION_EXPRESSION:
                return closure(node);
            case ARROW_FUNCTION:
                return arrowFunction(node);
            case MATCH_EXPRESSION:
                return match(node);
            case THROW_EXPRESSION:
                return mapThrow(node, true);
            case CLONE_EXPRESSION:
            case PRINT_INTRINSIC:
            case INCLUDE_EXPRESSION:
            case INCLUDE_ONCE_EXPRESSION:
            case REQUIRE_EXPRESSION:
            case REQUIRE_ONCE_EXPRESSION:
                return intrinsic(node);
            case YIELD_EXPRESSION:
                return yieldExpression(node);
            case ARRAY_CREATION_EXPRESSION:
                return arrayLiteral(node);
            case LIST_LITERAL:
                return destructure(node);
            case BY_REF:
                return inner(node);
            default:
                return context.unknownExpression(node, "an expression");
        }
    }

    /**
     * Expressions of a comma-separated position, flattening nested sequences.
     */
    List<Expression> mapSequence(ConcreteNode node) {
        List<Expression> result = new ArrayList<>();
        if (node == null) return result;
        Deque<ConcreteNode> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            ConcreteNode current = pending.pop();
            if (current.grammarKind() == GrammarKind.SEQUENCE_EXPRESSION) {
                List<ConcreteNode> parts = significantChildren(current);
                for (int i = parts.size() - 1; i >= 0; i--) {
                    pending.push(parts.get(i));
                }
            } else {
                result.add(map(current));
            }
        }
        return result;
    }

    /**
     * Initializer of a parameter, property, constant or static variable, where {@code new} is gated.
     */
    Expression mapInitializer(ConcreteNode node) {
        if (node == null) return null;
        ConcreteNode creation = findObjectCreation(node);
        if (creation != null) {
            context.gate(Construct.NEW_IN_INITIALIZER, creation);
        }
        return map(node);
    }

    private ConcreteNode findObjectCreation(ConcreteNode root) {
        Deque<ConcreteNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ConcreteNode node = stack.pop();
            GrammarKind kind = node.grammarKind();
            if (kind == GrammarKind.OBJECT_CREATION_EXPRESSION) return node;
            if (kind == GrammarKind.ANONYMOUS_FUNCTION || kind == GrammarKind.ARROW_FUNCTION) continue;
            List<ConcreteNode> children = significantChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }

    private Expression inner(ConcreteNode node) {
        List<ConcreteNode> children = significantChildren(node);
        if (children.isEmpty()) {
            return context.unknownExpression(node, "an expression");
        }
        return map(children.get(0));
    }

    private Expression parenthesized(ConcreteNode node) {
        return inner(node);
    }

    // Names and variables

    private Expression variable(ConcreteNode node) {
        String text = context.text(node).trim();
        return new Variable(context.span(node), text.startsWith("$") ? text.substring(1) : text, null);
    }

    private Expression dynamicVariable(ConcreteNode node) {
        return new Variable(context.span(node), null, inner(node));
    }

    NameReference nameReference(ConcreteNode node) {
        return new NameReference(context.span(node), normalizeInline(context.text(node)));
    }

    /**
     * Class reference or scope qualifier: a bare name stays a name, anything else is an expression.
     */
    Expression scope(ConcreteNode node) {
        if (isKindOneOf(node.kind(), "name", "qualified_name", "relative_scope", "named_type")) {
            return nameReference(node);
        }
        return map(node);
    }

    // Literals

    private Expression integer(ConcreteNode node) {
        String text = context.text(node).trim();
        if (text.indexOf('_') >= 0) context.gate(Construct.NUMERIC_LITERAL_SEPARATOR, node);
        if (PhpLiterals.isExplicitOctal(text)) context.gate(Construct.EXPLICIT_OCTAL_LITERAL, node);
        try {
            Number value = PhpLiterals.parseInteger(text);
            if (value instanceof Long) {
                return new IntegerLiteral(context.span(node), value.longValue());
            }
            return new FloatLiteral(context.span(node), value.doubleValue());
        } catch (NumberFormatException e) {
            return invalidNumber(node, text);
        }
    }

    private Expression floating(ConcreteNode node) {
        String text = context.text(node).trim();
        if (text.indexOf('_') >= 0) context.gate(Construct.NUMERIC_LITERAL_SEPARATOR, node);
        try {
            return new FloatLiteral(context.span(node), PhpLiterals.parseFloat(text));
        } catch (NumberFormatException e) {
            return invalidNumber(node, text);
        }
    }

    private Expression invalidNumber(ConcreteNode node, String text) {
        String message = "Invalid numeric literal " + text;
        context.getDiagnostics().error(DiagnosticCode.SYNTAX_ERROR, context.span(node), message);
        return new UnknownExpression(context.span(node), node.kind(), message);
    }

    private Expression singleQuoted(ConcreteNode node) {
        String text = context.text(node);
        if (text.startsWith("b") || text.startsWith("B")) text = text.substring(1);
        if (text.length() >= 2 && text.startsWith("\"")) {
            return new StringLiteral(context.span(node), PhpLiterals.decodeDoubleQuoted(text.substring(1, text.length() - 1)));
        }
        String body = text.length() >= 2 ? text.substring(1, text.length() - 1) : "";
        return new StringLiteral(context.span(node), PhpLiterals.decodeSingleQuoted(body));
    }

    private Expression heredoc(ConcreteNode node) {
        ConcreteNode body = findFirstChild(node, "heredoc_body");
        if (body == null) return new StringLiteral(context.span(node), "");
        return interpolated(node, body, closingIndent(node));
    }

    private Expression nowdoc(ConcreteNode node) {
        StringBuilder value = new StringBuilder();
        ConcreteNode body = findFirstChild(node, "nowdoc_body");
        int indent = closingIndent(node);
        if (body != null) {
            for (ConcreteNode part : findAllChildren(body, "nowdoc_string")) {
                value.append(dedent(part, context.text(part), indent));
            }
        }
        return new StringLiteral(context.span(node), value.toString());
    }

    /**
     * Width of the whitespace before the closing marker. From PHP 7.3 that much indentation is
     * removed from every line of the body; earlier dialects keep the body as written.
     */
    private int closingIndent(ConcreteNode node) {
        ConcreteNode end = findFirstChild(node, "heredoc_end");
        if (end == null || !context.getDialect().isAtLeast(Dialect.PHP_7_3)) return 0;
        int column = context.span(end.startByte(), end.startByte()).getStart().getColumn();
        String leading = context.slice(end.startByte() - (column - 1), end.startByte()) + context.text(end);
        int indent = 0;
        while (indent < leading.length() && (leading.charAt(indent) == ' ' || leading.charAt(indent) == '\t')) {
            indent++;
        }
        return indent;
    }

    /**
     * Removes up to {@code indent} spaces or tabs from each line of {@code raw} that starts a line
     * in the source.
     */
    private String dedent(ConcreteNode piece, String raw, int indent) {
        if (indent == 0) return raw;
        boolean atLineStart = context.span(piece.startByte(), piece.startByte()).getStart().getColumn() == 1;
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            if (atLineStart) {
                int removed = 0;
                while (removed < indent && i < raw.length() && (raw.charAt(i) == ' ' || raw.charAt(i) == '\t')) {
                    i++;
                    removed++;
                }
                atLineStart = false;
                continue;
            }
            char c = raw.charAt(i++);
            out.append(c);
            atLineStart = c == '\n';
        }
        return out.toString();
    }

    /**
     * Double-quoted or heredoc content. Adjacent literal pieces merge into one string part; a
     * string without embedded expressions maps to a plain {@link StringLiteral}.
     */
    private Expression interpolated(ConcreteNode node, ConcreteNode container) {
        return interpolated(node, container, 0);
    }

    private Expression interpolated(ConcreteNode node, ConcreteNode container, int indent) {
        List<Expression> parts = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int chunkStart = -1;
        int chunkEnd = -1;
        for (ConcreteNode child : container.children()) {
            if (!child.isNamed() || child.grammarKind() == GrammarKind.COMMENT) continue;
            switch (child.grammarKind()) {
                case STRING_CONTENT:
                case STRING_VALUE:
                case ESCAPE_SEQUENCE:
                case TEXT:
                    if (chunkStart < 0) chunkStart = child.startByte();
                    chunkEnd = child.endByte();
                    chunk.append(PhpLiterals.decodeDoubleQuoted(dedent(child, context.text(child), indent)));
                    break;
                default:
                    if (chunkStart >= 0) {
                        parts.add(new StringLiteral(context.span(chunkStart, chunkEnd), chunk.toString()));
                        chunk.setLength(0);
                        chunkStart = -1;
                    }
                    parts.add(map(child));
            }
        }
        if (chunkStart >= 0) {
            parts.add(new StringLiteral(context.span(chunkStart, chunkEnd), chunk.toString()));
        }
        if (parts.isEmpty()) {
            return new StringLiteral(context.span(node), "");
        }
        if (parts.size() == 1 && parts.get(0) instanceof StringLiteral) {
            return new StringLiteral(context.span(node), ((StringLiteral) parts.get(0)).value);
        }
        return new InterpolatedString(context.span(node), parts);
    }

    // Operators

    private Expression assignment(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode left = fieldOr(node, "left", operands, 0);
        ConcreteNode right = fieldOr(node, "right", operands, operands.size() - 1);
        if (left == null || right == null) {
            return context.unknownExpression(node, "an assignment");
        }
        boolean byRef = node.grammarKind() == GrammarKind.REFERENCE_ASSIGNMENT_EXPRESSION;
        String operator = "=";
        if (node.grammarKind() == GrammarKind.AUGMENTED_ASSIGNMENT_EXPRESSION) {
            operator = operatorBetween(node, left, right);
            if ("??=".equals(operator)) {
                context.gate(Construct.NULL_COALESCING_ASSIGNMENT, node);
            }
        }
        Expression target;
        if (left.grammarKind() == GrammarKind.LIST_LITERAL
                || (left.grammarKind() == GrammarKind.ARRAY_CREATION_EXPRESSION && "=".equals(operator))) {
            target = destructure(left);
        } else {
            target = map(left);
        }
        return new Assignment(context.span(node), operator, byRef, target, map(right));
    }

    private Expression binary(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode left = fieldOr(node, "left", operands, 0);
        ConcreteNode right = fieldOr(node, "right", operands, operands.size() - 1);
        if (left == null || right == null || left == right) {
            return context.unknownExpression(node, "a binary operation");
        }
        String operator = operatorBetween(node, left, right).toLowerCase();
        Expression rightOperand = "instanceof".equals(operator) ? scope(right) : map(right);
        return new BinaryOperation(context.span(node), operator, map(left), rightOperand);
    }

    private Expression unary(ConcreteNode node) {
        ConcreteNode operatorToken = firstToken(node);
        List<ConcreteNode> operands = significantChildren(node);
        if (operatorToken == null || operands.isEmpty()) {
            return context.unknownExpression(node, "a unary operation");
        }
        return new UnaryOperation(context.span(node), operatorToken.kind(), false, map(operands.get(0)));
    }

    private Expression update(ConcreteNode node) {
        List<ConcreteNode> children = node.children();
        List<ConcreteNode> operands = significantChildren(node);
        if (children.isEmpty() || operands.isEmpty()) {
            return context.unknownExpression(node, "an increment or decrement");
        }
        boolean prefix = !children.get(0).isNamed();
        ConcreteNode operatorToken = prefix ? children.get(0) : children.get(children.size() - 1);
        return new UnaryOperation(context.span(node), operatorToken.kind(), !prefix, map(operands.get(0)));
    }

    private Expression cast(ConcreteNode node) {
        ConcreteNode type = fieldOrKind(node, "type", "cast_type");
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode value = node.field("value").orElse(operands.isEmpty() ? null : operands.get(operands.size() - 1));
        if (type == null || value == null || value == type) {
            return context.unknownExpression(node, "a cast");
        }
        String castType = normalizeInline(context.text(type)).toLowerCase();
        switch (castType) {
            case "integer":
                castType = "int";
                break;
            case "boolean":
                castType = "bool";
                break;
            case "double":
                castType = "float";
                break;
            case "real":
                context.gate(Construct.REAL_CAST, type);
                castType = "float";
                break;
            case "binary":
                castType = "string";
                break;
            case "unset":
                context.gate(Construct.UNSET_CAST, type);
                break;
            default:
                break;
        }
        return new CastExpression(context.span(node), castType, map(value));
    }

    private Expression conditional(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode condition = node.field("condition").orElse(operands.isEmpty() ? null : operands.get(0));
        ConcreteNode alternative = node.field("alternative").orElse(operands.size() < 2 ? null : operands.get(operands.size() - 1));
        ConcreteNode body = node.field("body").orElse(operands.size() == 3 ? operands.get(1) : null);
        if (condition == null || alternative == null) {
            return context.unknownExpression(node, "a conditional expression");
        }
        if (isUnparenthesizedNesting(body == null, condition) || isUnparenthesizedNesting(body == null, alternative)) {
            InterpretationChoice reading = context.getResolver()
                    .resolveAmbiguity(Ambiguity.NESTED_TERNARY, context.getDialect());
            if (reading == InterpretationChoice.REJECT) {
                context.getDiagnostics().error(DiagnosticCode.AMBIGUOUS_CONSTRUCT, context.span(node),
                        "Nested ternary without parentheses is not allowed in " + context.getDialect());
            } else {
                context.gate(Construct.UNPARENTHESIZED_NESTED_TERNARY, node);
            }
        }
        return new TernaryExpression(context.span(node), map(condition), body == null ? null : map(body),
                map(alternative));
    }

    private boolean isUnparenthesizedNesting(boolean outerShort, ConcreteNode operand) {
        if (operand.grammarKind() != GrammarKind.CONDITIONAL_EXPRESSION) return false;
        boolean innerShort = operand.field("body").isEmpty() && significantChildren(operand).size() == 2;
        // Chains made only of short ternaries are unambiguous
        return !(outerShort && innerShort);
    }

    // Calls and member access

    private Expression functionCall(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode function = node.field("function").orElse(operands.isEmpty() ? null : operands.get(0));
        if (function == null) {
            return context.unknownExpression(node, "a function call");
        }
        ArgumentList arguments = arguments(fieldOrKind(node, "arguments", "arguments"));
        return new FunctionCall(context.span(node), arguments.firstClassCallable, scope(function), arguments.arguments);
    }

    private Expression methodCall(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode object = fieldOr(node, "object", operands, 0);
        ConcreteNode name = fieldOr(node, "name", operands, 1);
        if (object == null || name == null) {
            return context.unknownExpression(node, "a method call");
        }
        boolean nullsafe = node.grammarKind() == GrammarKind.NULLSAFE_MEMBER_CALL_EXPRESSION;
        if (nullsafe) context.gate(Construct.NULLSAFE_OPERATOR, node);
        ArgumentList arguments = arguments(fieldOrKind(node, "arguments", "arguments"));
        Expression objectExpression = map(object);
        return new MethodCall(context.span(node), memberName(name), nullsafe, arguments.firstClassCallable,
                objectExpression, memberNameExpression(name), arguments.arguments);
    }

    private Expression staticCall(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode scope = fieldOr(node, "scope", operands, 0);
        ConcreteNode name = fieldOr(node, "name", operands, 1);
        if (scope == null || name == null) {
            return context.unknownExpression(node, "a static call");
        }
        ArgumentList arguments = arguments(fieldOrKind(node, "arguments", "arguments"));
        return new StaticCall(context.span(node), memberName(name), arguments.firstClassCallable, scope(scope),
                memberNameExpression(name), arguments.arguments);
    }

    private Expression propertyFetch(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode object = fieldOr(node, "object", operands, 0);
        ConcreteNode name = fieldOr(node, "name", operands, 1);
        if (object == null || name == null) {
            return context.unknownExpression(node, "a property fetch");
        }
        boolean nullsafe = node.grammarKind() == GrammarKind.NULLSAFE_MEMBER_ACCESS_EXPRESSION;
        if (nullsafe) context.gate(Construct.NULLSAFE_OPERATOR, node);
        Expression objectExpression = map(object);
        return new PropertyFetch(context.span(node), memberName(name), nullsafe, objectExpression,
                memberNameExpression(name));
    }

    private Expression staticPropertyFetch(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        ConcreteNode scope = fieldOr(node, "scope", operands, 0);
        ConcreteNode name = fieldOr(node, "name", operands, 1);
        if (scope == null || name == null) {
            return context.unknownExpression(node, "a static property fetch");
        }
        Expression scopeExpression = scope(scope);
        if (name.grammarKind() == GrammarKind.VARIABLE_NAME) {
            return new StaticPropertyFetch(context.span(node), ((Variable) variable(name)).name, scopeExpression, null);
        }
        return new StaticPropertyFetch(context.span(node), null, scopeExpression, map(name));
    }

    private Expression classConstantFetch(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        if (operands.isEmpty()) {
            return context.unknownExpression(node, "a class constant fetch");
        }
        Expression scope = scope(operands.get(0));
        if (operands.size() < 2) {
            // Foo::class, where "class" stays an anonymous keyword token
            ConcreteNode keyword = findToken(node, "class");
            return new ClassConstantFetch(context.span(node), keyword != null ? "class" : null, scope, null);
        }
        ConcreteNode name = operands.get(operands.size() - 1);
        if (name.grammarKind() == GrammarKind.NAME || !name.isNamed()) {
            return new ClassConstantFetch(context.span(node), context.text(name).trim(), scope, null);
        }
        context.gate(Construct.DYNAMIC_CLASS_CONSTANT_FETCH, name);
        return new ClassConstantFetch(context.span(node), null, scope, map(name));
    }

    private Expression arrayAccess(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        if (operands.isEmpty()) {
            return context.unknownExpression(node, "an array access");
        }
        Expression target = map(operands.get(0));
        Expression index = operands.size() > 1 ? map(operands.get(1)) : null;
        return new ArrayAccess(context.span(node), target, index);
    }

    private String memberName(ConcreteNode name) {
        if (name.grammarKind() == GrammarKind.NAME || !name.isNamed()) {
            return context.text(name).trim();
        }
        return null;
    }

    private Expression memberNameExpression(ConcreteNode name) {
        if (name.grammarKind() == GrammarKind.NAME || !name.isNamed()) {
            return null;
        }
        return map(name);
    }

    private Expression objectCreation(ConcreteNode node) {
        ConcreteNode anonymous = findFirstChild(node, "anonymous_class");
        if (anonymous == null && hasToken(node, "class")) {
            anonymous = node;
        }
        if (anonymous != null) {
            ArgumentList arguments = arguments(findFirstChild(anonymous, "arguments"));
            AstNode declaration = pass.declarations.anonymousClass(anonymous);
            return new NewExpression(context.span(node), declaration, arguments.arguments);
        }
        ConcreteNode classReference = null;
        for (ConcreteNode child : significantChildren(node)) {
            if (child.grammarKind() != GrammarKind.ARGUMENTS) {
                classReference = child;
                break;
            }
        }
        if (classReference == null) {
            return context.unknownExpression(node, "an object creation");
        }
        ArgumentList arguments = arguments(findFirstChild(node, "arguments"));
        return new NewExpression(context.span(node), scope(classReference), arguments.arguments);
    }

    ArgumentList arguments(ConcreteNode node) {
        ArgumentList result = new ArgumentList();
        if (node == null) return result;
        ConcreteNode placeholder = findFirstChild(node, "variadic_placeholder");
        if (placeholder != null) {
            context.gate(Construct.FIRST_CLASS_CALLABLE, placeholder);
            result.firstClassCallable = true;
            return result;
        }
        for (ConcreteNode child : significantChildren(node)) {
            if (child.grammarKind() == GrammarKind.ARGUMENT) {
                result.arguments.add(argument(child));
            } else {
                result.arguments.add(new Argument(context.span(child), null, false, false, map(child)));
            }
        }
        return result;
    }

    private Argument argument(ConcreteNode node) {
        ConcreteNode name = node.field("name").orElse(null);
        if (name != null) {
            context.gate(Construct.NAMED_ARGUMENTS, name);
        }
        boolean spread = hasToken(node, "...");
        boolean byRef = hasToken(node, "&") || findFirstChild(node, "reference_modifier") != null;
        ConcreteNode value = null;
        for (ConcreteNode child : significantChildren(node)) {
            if (child == name || child.grammarKind() == GrammarKind.REFERENCE_MODIFIER) continue;
            value = child;
        }
        if (value != null && value.grammarKind() == GrammarKind.VARIADIC_UNPACKING) {
            spread = true;
            List<ConcreteNode> inner = significantChildren(value);
            value = inner.isEmpty() ? value : inner.get(0);
        }
        Expression expression = value == null
                ? context.unknownExpression(node, "an argument value")
                : map(value);
        return new Argument(context.span(node), name == null ? null : context.text(name).trim(), spread, byRef, expression);
    }

    // Functions

    private Expression closure(ConcreteNode node) {
        boolean isStatic = findFirstChild(node, "static_modifier") != null || hasToken(node, "static");
        boolean byRef = findFirstChild(node, "reference_modifier") != null || hasToken(node, "&");
        context.enterScope(DeclarationScope.of(DeclarationScope.Kind.CLOSURE));
        try {
            List<Declaration> parameters = pass.declarations.parameters(fieldOrKind(node, "parameters", "formal_parameters"));
            List<ClosureUse> uses = new ArrayList<>();
            ConcreteNode useClause = findFirstChild(node, "anonymous_function_use_clause");
            if (useClause != null) {
                for (ConcreteNode used : significantChildren(useClause)) {
                    if (used.grammarKind() == GrammarKind.BY_REF) {
                        ConcreteNode variable = findFirstChild(used, "variable_name");
                        String name = variable == null ? null : ((Variable) variable(variable)).name;
                        uses.add(new ClosureUse(context.span(used), name, true));
                    } else if (used.grammarKind() == GrammarKind.VARIABLE_NAME) {
                        uses.add(new ClosureUse(context.span(used), ((Variable) variable(used)).name, false));
                    }
                }
            }
            TypeHint returnType = pass.types.mapReturnType(node.field("return_type").orElse(null));
            ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
            Block block = body == null ? new Block(context.zeroWidthAt(node), List.of()) : pass.statements.block(body);
            return new Closure(context.span(node), isStatic, byRef, returnType, parameters, uses, block);
        } finally {
            context.exitScope();
        }
    }

    private Expression arrowFunction(ConcreteNode node) {
        context.gate(Construct.ARROW_FUNCTION, node);
        boolean isStatic = findFirstChild(node, "static_modifier") != null || hasToken(node, "static");
        boolean byRef = findFirstChild(node, "reference_modifier") != null || hasToken(node, "&");
        context.enterScope(DeclarationScope.of(DeclarationScope.Kind.CLOSURE));
        try {
            List<Declaration> parameters = pass.declarations.parameters(fieldOrKind(node, "parameters", "formal_parameters"));
            TypeHint returnType = pass.types.mapReturnType(node.field("return_type").orElse(null));
            List<ConcreteNode> operands = significantChildren(node);
            ConcreteNode body = node.field("body").orElse(operands.isEmpty() ? null : operands.get(operands.size() - 1));
            if (body == null) {
                return context.unknownExpression(node, "an arrow function");
            }
            return new ArrowFunction(context.span(node), isStatic, byRef, returnType, parameters, map(body));
        } finally {
            context.exitScope();
        }
    }

    // PHP 8 expressions

    private Expression match(ConcreteNode node) {
        if (!context.gate(Construct.MATCH_EXPRESSION, node).keepsConstruct()) {
            return context.rejectedExpression(node, Construct.MATCH_EXPRESSION);
        }
        ConcreteNode condition = fieldOrKind(node, "condition", "parenthesized_expression");
        ConcreteNode block = fieldOrKind(node, "body", "match_block");
        if (condition == null || block == null) {
            return context.unknownExpression(node, "a match expression");
        }
        List<MatchArm> arms = new ArrayList<>();
        List<UnknownExpression> malformed = new ArrayList<>();
        for (ConcreteNode arm : significantChildren(block)) {
            switch (arm.grammarKind()) {
                case MATCH_CONDITIONAL_EXPRESSION: {
                    ConcreteNode conditions = fieldOrKind(arm, "conditional_expressions", "match_condition_list");
                    List<Expression> tests = new ArrayList<>();
                    for (ConcreteNode test : significantChildren(conditions)) {
                        tests.add(map(test));
                    }
                    arms.add(new MatchArm(context.span(arm), false, tests, armBody(arm)));
                    break;
                }
                case MATCH_DEFAULT_EXPRESSION:
                    arms.add(new MatchArm(context.span(arm), true, List.of(), armBody(arm)));
                    break;
                default:
                    malformed.add(context.unknownExpression(arm, "a match arm"));
            }
        }
        return new MatchExpression(context.span(node), map(condition), arms, malformed);
    }

    private Expression armBody(ConcreteNode arm) {
        List<ConcreteNode> operands = significantChildren(arm);
        ConcreteNode body = arm.field("return_expression").orElse(operands.isEmpty() ? null : operands.get(operands.size() - 1));
        if (body == null || body.grammarKind() == GrammarKind.MATCH_CONDITION_LIST) {
            return context.unknownExpression(arm, "a match arm body");
        }
        return map(body);
    }

    /**
     * {@code throw}; only gated where it is used as an expression rather than as a statement.
     */
    Expression mapThrow(ConcreteNode node, boolean asExpression) {
        if (asExpression) {
            context.gate(Construct.THROW_EXPRESSION, node);
        }
        List<ConcreteNode> operands = significantChildren(node);
        if (operands.isEmpty()) {
            return context.unknownExpression(node, "a thrown value");
        }
        return new ThrowExpression(context.span(node), map(operands.get(0)));
    }

    private Expression intrinsic(ConcreteNode node) {
        String keyword;
        switch (node.grammarKind()) {
            case CLONE_EXPRESSION:
                keyword = "clone";
                break;
            case PRINT_INTRINSIC:
                keyword = "print";
                break;
            case INCLUDE_EXPRESSION:
                keyword = "include";
                break;
            case INCLUDE_ONCE_EXPRESSION:
                keyword = "include_once";
                break;
            case REQUIRE_EXPRESSION:
                keyword = "require";
                break;
            default:
                keyword = "require_once";
        }
        List<ConcreteNode> operands = significantChildren(node);
        return new IntrinsicExpression(context.span(node), keyword, operands.isEmpty() ? null : map(operands.get(0)));
    }

    IntrinsicExpression exit(ConcreteNode node) {
        List<ConcreteNode> operands = significantChildren(node);
        return new IntrinsicExpression(context.span(node), "exit", operands.isEmpty() ? null : map(operands.get(0)));
    }

    private Expression yieldExpression(ConcreteNode node) {
        boolean delegate = hasToken(node, "from") || hasToken(node, "yield from");
        List<ConcreteNode> operands = significantChildren(node);
        if (operands.isEmpty()) {
            return new YieldExpression(context.span(node), false, null, null);
        }
        ConcreteNode operand = operands.get(0);
        if (operand.grammarKind() == GrammarKind.ARRAY_ELEMENT_INITIALIZER && hasToken(operand, "=>")) {
            List<ConcreteNode> pair = significantChildren(operand);
            if (pair.size() == 2) {
                return new YieldExpression(context.span(node), false, map(pair.get(0)), map(pair.get(1)));
            }
        }
        if (operand.grammarKind() == GrammarKind.ARRAY_ELEMENT_INITIALIZER) {
            return new YieldExpression(context.span(node), delegate, null, inner(operand));
        }
        return new YieldExpression(context.span(node), delegate, null, map(operand));
    }

    // Arrays and destructuring

    private Expression arrayLiteral(ConcreteNode node) {
        InterpretationChoice reading = context.getResolver()
                .resolveAmbiguity(Ambiguity.ARRAY_SPELLING, context.getDialect());
        String spelling = reading == InterpretationChoice.ARRAY_LITERAL ? null
                : isShortForm(node) ? "short" : "array";
        return new ArrayLiteral(context.span(node), elements(node, false), spelling);
    }

    /**
     * Destructuring target; {@code list()} and the short bracket form map to the same node.
     */
    Expression destructure(ConcreteNode node) {
        boolean shortForm = isShortForm(node);
        if (shortForm) {
            context.gate(Construct.SHORT_LIST_DESTRUCTURING, node);
        }
        InterpretationChoice reading = context.getResolver()
                .resolveAmbiguity(Ambiguity.LIST_SPELLING, context.getDialect());
        String spelling = reading == InterpretationChoice.DESTRUCTURING ? null : shortForm ? "short" : "list";
        return new ListDestructure(context.span(node), elements(node, true), spelling);
    }

    private static boolean isShortForm(ConcreteNode node) {
        return !node.children().isEmpty() && "[".equals(node.children().get(0).kind());
    }

    private List<ArrayElement> elements(ConcreteNode node, boolean destructuring) {
        List<ArrayElement> result = new ArrayList<>();
        List<ConcreteNode> group = new ArrayList<>();
        for (ConcreteNode child : node.children()) {
            if (child.grammarKind() == GrammarKind.COMMENT) continue;
            if (!child.isNamed() && isKindOneOf(child.kind().toLowerCase(), "[", "]", "(", ")", "list", "array")) continue;
            if (!child.isNamed() && ",".equals(child.kind())) {
                addElement(result, group, destructuring);
                group.clear();
                continue;
            }
            group.add(child);
        }
        addElement(result, group, destructuring);
        return result;
    }

    private void addElement(List<ArrayElement> result, List<ConcreteNode> group, boolean destructuring) {
        if (group.isEmpty()) return;
        if (group.size() == 1 && group.get(0).grammarKind() == GrammarKind.ARRAY_ELEMENT_INITIALIZER) {
            ConcreteNode initializer = group.get(0);
            result.add(element(initializer.children(), context.span(initializer), destructuring));
            return;
        }
        Span span = context.span(group.get(0).startByte(), group.get(group.size() - 1).endByte());
        result.add(element(group, span, destructuring));
    }

    private ArrayElement element(List<ConcreteNode> parts, Span span, boolean destructuring) {
        int arrow = -1;
        for (int i = 0; i < parts.size(); i++) {
            if (!parts.get(i).isNamed() && "=>".equals(parts.get(i).kind())) {
                arrow = i;
                break;
            }
        }
        ConcreteNode key = null;
        ConcreteNode value = null;
        boolean byRef = false;
        boolean spread = false;
        for (int i = 0; i < parts.size(); i++) {
            ConcreteNode part = parts.get(i);
            if (!part.isNamed()) {
                if ("&".equals(part.kind())) byRef = true;
                if ("...".equals(part.kind())) spread = true;
                continue;
            }
            if (part.grammarKind() == GrammarKind.COMMENT) continue;
            if (i < arrow) {
                if (key == null) key = part;
            } else if (value == null) {
                value = part;
            }
        }
        if (value != null && value.grammarKind() == GrammarKind.BY_REF) {
            byRef = true;
            List<ConcreteNode> inner = significantChildren(value);
            value = inner.isEmpty() ? value : inner.get(0);
        }
        if (value != null && value.grammarKind() == GrammarKind.VARIADIC_UNPACKING) {
            spread = true;
            List<ConcreteNode> inner = significantChildren(value);
            value = inner.isEmpty() ? value : inner.get(0);
        }
        if (spread && !destructuring && value != null) {
            context.gate(Construct.ARRAY_SPREAD, value);
        }
        Expression keyExpression = key == null ? null : map(key);
        Expression valueExpression;
        if (value == null) {
            context.getDiagnostics().warning(DiagnosticCode.UNEXPECTED_NODE, span, "Array element without a value");
            valueExpression = new UnknownExpression(span, "array_element_initializer", "Array element without a value");
        } else if (destructuring && value.grammarKind() == GrammarKind.ARRAY_CREATION_EXPRESSION) {
            valueExpression = destructure(value);
        } else {
            valueExpression = map(value);
        }
        return new ArrayElement(span, byRef, spread, keyExpression, valueExpression);
    }

    // Lookup helpers

    private static ConcreteNode fieldOr(ConcreteNode node, String field, List<ConcreteNode> operands, int index) {
        return node.field(field).orElse(index >= 0 && index < operands.size() ? operands.get(index) : null);
    }

    private static ConcreteNode firstToken(ConcreteNode node) {
        for (ConcreteNode child : node.children()) {
            if (!child.isNamed()) return child;
        }
        return null;
    }

    private String operatorBetween(ConcreteNode node, ConcreteNode left, ConcreteNode right) {
        ConcreteNode operator = node.field("operator").orElse(null);
        if (operator != null) return context.text(operator).trim();
        for (ConcreteNode child : node.children()) {
            if (!child.isNamed() && child.startByte() >= left.endByte() && child.endByte() <= right.startByte()) {
                return child.kind();
            }
        }
        return "?";
    }

    static final class ArgumentList {
        final List<Argument> arguments = new ArrayList<>();
        boolean firstClassCallable;
    }
}
