package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.GrammarKind;
import org.dxworks.celerrate.dialect.Ambiguity;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.dialect.InterpretationChoice;
import org.dxworks.celerrate.model.*;
import org.dxworks.celerrate.span.Span;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.celerrate.cst.ConcreteNodeHelper.*;

/**
 * Statement rules and body canonicalization.
 */
final class StatementMapper {
    private final MappingPass pass;
    private final MappingContext context;
    private boolean echoTagOpen;

    StatementMapper(MappingPass pass) {
        this.pass = pass;
        this.context = pass.context;
    }

    /**
     * Top-level statements. An unbraced namespace takes every following statement up to the
     * next namespace, so it maps like its braced spelling.
     */
    List<AstNode> fileStatements(ConcreteNode root) {
        List<ConcreteNode> children = root.grammarKind() == GrammarKind.PROGRAM ? root.children() : List.of(root);
        List<AstNode> result = new ArrayList<>();
        NamespaceDeclaration open = null;
        List<AstNode> scoped = new ArrayList<>();
        for (ConcreteNode child : children) {
            if (!child.isNamed()) continue;
            boolean unbracedNamespace = child.grammarKind() == GrammarKind.NAMESPACE_DEFINITION
                    && findFirstChild(child, "compound_statement") == null;
            if (child.grammarKind() == GrammarKind.NAMESPACE_DEFINITION) {
                closeNamespace(open, scoped, result);
                open = null;
                scoped = new ArrayList<>();
            }
            List<AstNode> mapped = new ArrayList<>();
            mapInto(child, mapped);
            if (unbracedNamespace && mapped.size() == 1 && mapped.get(0) instanceof NamespaceDeclaration) {
                open = (NamespaceDeclaration) mapped.get(0);
            } else if (open != null) {
                scoped.addAll(mapped);
            } else {
                result.addAll(mapped);
            }
        }
        closeNamespace(open, scoped, result);
        return result;
    }

    private void closeNamespace(NamespaceDeclaration open, List<AstNode> scoped, List<AstNode> result) {
        if (open == null) return;
        Span span = scoped.isEmpty() ? open.getSpan() : Span.cover(open.getSpan(), scoped.get(scoped.size() - 1).getSpan());
        result.add(new NamespaceDeclaration(span, open.name, scoped));
    }

    List<AstNode> statements(List<ConcreteNode> nodes) {
        List<AstNode> result = new ArrayList<>();
        for (ConcreteNode node : nodes) {
            mapInto(node, result);
        }
        return result;
    }

    /**
     * Maps one statement-position node. Tags, comments and empty statements produce nothing;
     * declarations with several elements produce one node each. A node whose rule skipped an
     * engine error inside it is replaced by a single placeholder.
     */
    void mapInto(ConcreteNode node, List<AstNode> out) {
        int first = out.size();
        mapNode(node, out);
        List<AstNode> mapped = out.subList(first, out.size());
        if (context.hidesSyntaxError(node, mapped)) {
            boolean declaration = !mapped.isEmpty() && mapped.stream().allMatch(n -> n instanceof Declaration);
            mapped.clear();
            out.add(declaration ? context.malformedDeclaration(node) : context.malformedStatement(node));
        }
    }

    private void mapNode(ConcreteNode node, List<AstNode> out) {
        boolean afterEchoTag = echoTagOpen;
        echoTagOpen = false;
        if (node.isError() || node.isMissing()) {
            out.add(context.unknownStatement(node, "a statement"));
            return;
        }
        switch (node.grammarKind()) {
            case PHP_TAG:
                echoTagOpen = isEchoTag(node);
                return;
            case COMMENT:
                echoTagOpen = afterEchoTag;
                return;
            case EMPTY_STATEMENT:
                return;
            case TEXT:
                out.add(new InlineHtml(context.span(node), context.text(node)));
                return;
            case TEXT_INTERPOLATION: {
                ConcreteNode text = findFirstChild(node, "text");
                if (text != null) {
                    out.add(new InlineHtml(context.span(text), context.text(text)));
                }
                echoTagOpen = isEchoTag(findFirstChild(node, "php_tag"));
                return;
            }
            case EXPRESSION_STATEMENT:
                out.add(afterEchoTag ? shortEcho(node) : expressionStatement(node));
                return;
            case NAMESPACE_DEFINITION:
            case NAMESPACE_USE_DECLARATION:
            case CLASS_DECLARATION:
            case INTERFACE_DECLARATION:
            case TRAIT_DECLARATION:
            case ENUM_DECLARATION:
            case FUNCTION_DEFINITION:
            case CONST_DECLARATION:
                pass.declarations.mapTopLevel(node, out);
                return;
            default:
                out.add(statement(node));
        }
    }

    private Statement statement(ConcreteNode node) {
        switch (node.grammarKind()) {
            case COMPOUND_STATEMENT:
                return block(node);
            case EXPRESSION_STATEMENT:
                return expressionStatement(node);
            case ECHO_STATEMENT:
                return echo(node);
            case RETURN_STATEMENT: {
                ConcreteNode value = firstSignificant(node);
                return new ReturnStatement(context.span(node), value == null ? null : pass.expressions.map(value));
            }
            case IF_STATEMENT:
                return ifStatement(node);
            case WHILE_STATEMENT:
                return whileStatement(node);
            case DO_STATEMENT:
                return doWhile(node);
            case FOR_STATEMENT:
                return forStatement(node);
            case FOREACH_STATEMENT:
                return foreach(node);
            case SWITCH_STATEMENT:
                return switchStatement(node);
            case BREAK_STATEMENT: {
                ConcreteNode levels = firstSignificant(node);
                return new BreakStatement(context.span(node), levels == null ? null : pass.expressions.map(levels));
            }
            case CONTINUE_STATEMENT: {
                ConcreteNode levels = firstSignificant(node);
                return new ContinueStatement(context.span(node), levels == null ? null : pass.expressions.map(levels));
            }
            case TRY_STATEMENT:
                return tryStatement(node);
            case GLOBAL_DECLARATION:
                return new GlobalStatement(context.span(node), mapAll(significantChildren(node)));
            case FUNCTION_STATIC_DECLARATION:
                return staticVariables(node);
            case UNSET_STATEMENT:
                return new UnsetStatement(context.span(node), mapAll(significantChildren(node)));
            case DECLARE_STATEMENT:
                return declare(node);
            case GOTO_STATEMENT: {
                ConcreteNode label = firstSignificant(node);
                return new GotoStatement(context.span(node), label == null ? null : context.text(label).trim());
            }
            case NAMED_LABEL_STATEMENT: {
                ConcreteNode label = firstSignificant(node);
                return new LabelStatement(context.span(node), label == null ? null : context.text(label).trim());
            }
            case EXIT_STATEMENT:
                return new ExpressionStatement(context.span(node), pass.expressions.exit(node));
            default:
                return context.unknownStatement(node, "a statement");
        }
    }

    /**
     * Body of a statement. Braces, alternative syntax and a single statement all give a
     * {@link Block}; unless the dialect reads them canonically, the block records its spelling.
     */
    Block block(ConcreteNode node) {
        switch (node.grammarKind()) {
            case COMPOUND_STATEMENT:
                return new Block(context.span(node), statements(significantChildren(node)),
                        spelling(Ambiguity.STATEMENT_BODY, "braces"));
            case COLON_BLOCK:
                return new Block(context.span(node), statements(significantChildren(node)),
                        spelling(Ambiguity.ALTERNATIVE_SYNTAX, "colon"));
            default: {
                List<AstNode> single = new ArrayList<>();
                mapInto(node, single);
                return new Block(context.span(node), single, spelling(Ambiguity.STATEMENT_BODY, "statement"));
            }
        }
    }

    private String spelling(Ambiguity ambiguity, String asWritten) {
        InterpretationChoice reading = context.getResolver().resolveAmbiguity(ambiguity, context.getDialect());
        return reading == InterpretationChoice.BLOCK ? null : asWritten;
    }

    /**
     * Alternative-syntax body written directly after a colon token, as in {@code for (...): ... endfor;}.
     */
    private Block colonBody(ConcreteNode node, ConcreteNode colon) {
        List<ConcreteNode> body = new ArrayList<>();
        int end = colon.endByte();
        for (ConcreteNode child : node.children()) {
            if (child.startByte() < colon.endByte()) continue;
            if (!child.isNamed()) {
                if (child.kind().toLowerCase().startsWith("end")) break;
                continue;
            }
            body.add(child);
            end = child.endByte();
        }
        return new Block(context.span(colon.startByte(), end), statements(body),
                spelling(Ambiguity.ALTERNATIVE_SYNTAX, "colon"));
    }

    private Statement expressionStatement(ConcreteNode node) {
        ConcreteNode expression = firstSignificant(node);
        if (expression == null) {
            return context.unknownStatement(node, "an expression statement");
        }
        Expression mapped = expression.grammarKind() == GrammarKind.THROW_EXPRESSION
                ? pass.expressions.mapThrow(expression, false)
                : pass.expressions.map(expression);
        return new ExpressionStatement(context.span(node), mapped);
    }

    private boolean isEchoTag(ConcreteNode tag) {
        return tag != null && "<?=".equals(context.text(tag).trim());
    }

    /**
     * {@code <?= $a, $b ?>}, which PHP reads as {@code echo $a, $b;}.
     */
    private Statement shortEcho(ConcreteNode node) {
        ConcreteNode expression = firstSignificant(node);
        if (expression == null) {
            return context.unknownStatement(node, "an echo tag expression");
        }
        return new EchoStatement(context.span(node), pass.expressions.mapSequence(expression));
    }

    private Statement echo(ConcreteNode node) {
        List<Expression> values = new ArrayList<>();
        for (ConcreteNode child : significantChildren(node)) {
            values.addAll(pass.expressions.mapSequence(child));
        }
        return new EchoStatement(context.span(node), values);
    }

    private Statement ifStatement(ConcreteNode node) {
        ConcreteNode condition = fieldOrKind(node, "condition", "parenthesized_expression");
        ConcreteNode body = node.field("body").orElse(null);
        if (body == null) {
            body = bodyAfter(node, condition);
        }
        if (condition == null || body == null) {
            return context.unknownStatement(node, "an if statement");
        }
        Expression test = pass.expressions.map(condition);
        Block then = block(body);
        List<ElseIfClause> elseIfs = new ArrayList<>();
        Block otherwise = null;
        for (ConcreteNode alternative : significantChildren(node)) {
            if (alternative.grammarKind() == GrammarKind.ELSE_IF_CLAUSE) {
                elseIfs.add(elseIf(alternative));
            } else if (alternative.grammarKind() == GrammarKind.ELSE_CLAUSE) {
                ConcreteNode elseBody = alternative.field("body").orElse(firstSignificant(alternative));
                if (elseBody == null) {
                    otherwise = new Block(context.zeroWidthAt(alternative), List.of());
                    continue;
                }
                InterpretationChoice reading = context.getResolver()
                        .resolveAmbiguity(Ambiguity.ELSE_IF_SPELLING, context.getDialect());
                Statement mapped = elseBody.grammarKind() == GrammarKind.IF_STATEMENT ? statement(elseBody) : null;
                if (reading == InterpretationChoice.ELSEIF_CLAUSE && mapped instanceof IfStatement) {
                    // "else if" folds into the same chain as "elseif"
                    IfStatement nested = (IfStatement) mapped;
                    Span span = context.span(alternative.startByte(), nested.thenBlock.getSpan().getEndOffset());
                    elseIfs.add(new ElseIfClause(span, nested.condition, nested.thenBlock));
                    elseIfs.addAll(nested.elseIfs);
                    otherwise = nested.elseBlock;
                } else if (mapped != null) {
                    otherwise = new Block(context.span(elseBody), List.of(mapped),
                            spelling(Ambiguity.STATEMENT_BODY, "statement"));
                } else {
                    otherwise = block(elseBody);
                }
            }
        }
        return new IfStatement(context.span(node), test, then, elseIfs, otherwise);
    }

    private ElseIfClause elseIf(ConcreteNode node) {
        ConcreteNode condition = fieldOrKind(node, "condition", "parenthesized_expression");
        ConcreteNode body = node.field("body").orElse(null);
        if (body == null) {
            body = bodyAfter(node, condition);
        }
        Expression test = condition == null ? context.unknownExpression(node, "a condition") : pass.expressions.map(condition);
        Block block = body == null ? new Block(context.span(node.endByte(), node.endByte()), List.of()) : block(body);
        return new ElseIfClause(context.span(node), test, block);
    }

    private Statement whileStatement(ConcreteNode node) {
        ConcreteNode condition = fieldOrKind(node, "condition", "parenthesized_expression");
        if (condition == null) {
            return context.unknownStatement(node, "a while loop");
        }
        return new WhileStatement(context.span(node), pass.expressions.map(condition), loopBody(node, condition));
    }

    private Statement doWhile(ConcreteNode node) {
        List<ConcreteNode> parts = significantChildren(node);
        ConcreteNode body = node.field("body").orElse(parts.isEmpty() ? null : parts.get(0));
        ConcreteNode condition = node.field("condition").orElse(parts.size() < 2 ? null : parts.get(parts.size() - 1));
        if (body == null || condition == null) {
            return context.unknownStatement(node, "a do-while loop");
        }
        return new DoWhileStatement(context.span(node), block(body), pass.expressions.map(condition));
    }

    private Statement forStatement(ConcreteNode node) {
        List<List<ConcreteNode>> sections = new ArrayList<>();
        for (int i = 0; i < 3; i++) sections.add(new ArrayList<>());
        int section = 0;
        boolean inHeader = false;
        ConcreteNode closing = null;
        for (ConcreteNode child : node.children()) {
            if (!child.isNamed()) {
                if ("(".equals(child.kind()) && closing == null) {
                    inHeader = true;
                } else if (";".equals(child.kind()) && inHeader) {
                    section = Math.min(section + 1, 2);
                } else if (")".equals(child.kind()) && inHeader) {
                    inHeader = false;
                    closing = child;
                }
                continue;
            }
            if (inHeader && child.grammarKind() != GrammarKind.COMMENT) {
                sections.get(section).add(child);
            }
        }
        List<Expression> initializers = mapSequences(sections.get(0));
        List<Expression> conditions = mapSequences(sections.get(1));
        List<Expression> updates = mapSequences(sections.get(2));
        Block body = closing == null
                ? new Block(context.span(node.endByte(), node.endByte()), List.of())
                : loopBody(node, closing);
        return new ForStatement(context.span(node), initializers, conditions, updates, body);
    }

    private Statement foreach(ConcreteNode node) {
        List<ConcreteNode> parts = significantChildren(node);
        if (parts.size() < 2) {
            return context.unknownStatement(node, "a foreach loop");
        }
        Expression subject = pass.expressions.map(parts.get(0));
        ConcreteNode target = parts.get(1);
        Expression key = null;
        ConcreteNode valueNode = target;
        if (target.grammarKind() == GrammarKind.PAIR || "foreach_pair".equals(target.kind())) {
            List<ConcreteNode> pair = significantChildren(target);
            if (pair.size() == 2) {
                key = pass.expressions.map(pair.get(0));
                valueNode = pair.get(1);
            }
        }
        boolean byRef = false;
        if (valueNode.grammarKind() == GrammarKind.BY_REF) {
            byRef = true;
            ConcreteNode inner = firstSignificant(valueNode);
            valueNode = inner == null ? valueNode : inner;
        }
        Expression value;
        if (valueNode.grammarKind() == GrammarKind.LIST_LITERAL
                || valueNode.grammarKind() == GrammarKind.ARRAY_CREATION_EXPRESSION) {
            value = pass.expressions.destructure(valueNode);
        } else {
            value = pass.expressions.map(valueNode);
        }
        ConcreteNode closing = findToken(node, ")");
        Block body = closing == null ? new Block(context.span(node.endByte(), node.endByte()), List.of())
                : loopBody(node, closing);
        return new ForeachStatement(context.span(node), byRef, subject, key, value, body);
    }

    /**
     * Body of a loop that follows {@code after}: a statement, a colon block, an inline colon body,
     * or nothing for a bare semicolon.
     */
    private Block loopBody(ConcreteNode node, ConcreteNode after) {
        ConcreteNode body = node.field("body").orElse(null);
        if (body != null) return block(body);
        for (ConcreteNode child : node.children()) {
            if (child.startByte() < after.endByte() || child == after) continue;
            if (!child.isNamed() && ":".equals(child.kind())) {
                return colonBody(node, child);
            }
            if (child.isNamed() && child.grammarKind() != GrammarKind.COMMENT) {
                return block(child);
            }
            if (!child.isNamed() && ";".equals(child.kind())) {
                return new Block(context.span(child), List.of());
            }
        }
        return new Block(context.span(node.endByte(), node.endByte()), List.of());
    }

    private ConcreteNode bodyAfter(ConcreteNode node, ConcreteNode condition) {
        if (condition == null) return null;
        for (ConcreteNode child : significantChildren(node)) {
            if (child.startByte() >= condition.endByte()
                    && child.grammarKind() != GrammarKind.ELSE_IF_CLAUSE
                    && child.grammarKind() != GrammarKind.ELSE_CLAUSE) {
                return child;
            }
        }
        return null;
    }

    private Statement switchStatement(ConcreteNode node) {
        ConcreteNode condition = fieldOrKind(node, "condition", "parenthesized_expression");
        ConcreteNode block = fieldOrKind(node, "body", "switch_block");
        if (condition == null || block == null) {
            return context.unknownStatement(node, "a switch statement");
        }
        List<SwitchCase> cases = new ArrayList<>();
        List<UnknownStatement> malformed = new ArrayList<>();
        for (ConcreteNode child : significantChildren(block)) {
            List<ConcreteNode> parts = significantChildren(child);
            if (child.grammarKind() == GrammarKind.CASE_STATEMENT && !parts.isEmpty()) {
                ConcreteNode test = child.field("value").orElse(parts.get(0));
                List<ConcreteNode> body = new ArrayList<>(parts);
                body.remove(test);
                cases.add(new SwitchCase(context.span(child), pass.expressions.map(test), statements(body)));
            } else if (child.grammarKind() == GrammarKind.DEFAULT_STATEMENT) {
                cases.add(new SwitchCase(context.span(child), null, statements(parts)));
            } else {
                malformed.add(context.unknownStatement(child, "a switch case"));
            }
        }
        return new SwitchStatement(context.span(node), pass.expressions.map(condition), cases, malformed);
    }

    private Statement tryStatement(ConcreteNode node) {
        ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
        if (body == null) {
            return context.unknownStatement(node, "a try statement");
        }
        List<CatchClause> catches = new ArrayList<>();
        Block finallyBlock = null;
        for (ConcreteNode child : significantChildren(node)) {
            if (child.grammarKind() == GrammarKind.CATCH_CLAUSE) {
                catches.add(catchClause(child));
            } else if (child.grammarKind() == GrammarKind.FINALLY_CLAUSE) {
                ConcreteNode finallyBody = fieldOrKind(child, "body", "compound_statement");
                finallyBlock = finallyBody == null ? new Block(context.span(child), List.of()) : block(finallyBody);
            }
        }
        return new TryStatement(context.span(node), block(body), catches, finallyBlock);
    }

    private CatchClause catchClause(ConcreteNode node) {
        ConcreteNode typeList = fieldOrKind(node, "type", "type_list");
        List<String> types = new ArrayList<>();
        ConcreteNode typeContainer = typeList != null && typeList.grammarKind() == GrammarKind.TYPE_LIST ? typeList : node;
        for (ConcreteNode type : significantChildren(typeContainer)) {
            if (isKindOneOf(type.kind(), "named_type", "name", "qualified_name")) {
                types.add(normalizeInline(context.text(type)));
            }
        }
        if (types.size() > 1) {
            context.gate(Construct.MULTI_CATCH, typeList != null ? typeList : node);
        }
        ConcreteNode variable = fieldOrKind(node, "name", "variable_name");
        String name = variable == null ? null : context.text(variable).trim().substring(1);
        ConcreteNode body = fieldOrKind(node, "body", "compound_statement");
        Block block = body == null ? new Block(context.span(node.endByte(), node.endByte()), List.of()) : block(body);
        return new CatchClause(context.span(node), types, name, block);
    }

    private Statement staticVariables(ConcreteNode node) {
        List<StaticVariable> variables = new ArrayList<>();
        for (ConcreteNode declaration : findAllChildren(node, "static_variable_declaration")) {
            List<ConcreteNode> parts = significantChildren(declaration);
            ConcreteNode name = fieldOrKind(declaration, "name", "variable_name");
            ConcreteNode value = declaration.field("value").orElse(parts.size() > 1 ? parts.get(parts.size() - 1) : null);
            String variableName = name == null ? null : context.text(name).trim().substring(1);
            variables.add(new StaticVariable(context.span(declaration), variableName,
                    pass.expressions.mapInitializer(value)));
        }
        return new StaticVariableStatement(context.span(node), variables);
    }

    private Statement declare(ConcreteNode node) {
        Map<String, String> directives = new LinkedHashMap<>();
        ConcreteNode last = null;
        for (ConcreteNode directive : findAllChildren(node, "declare_directive")) {
            String text = normalizeInline(context.text(directive));
            int equals = text.indexOf('=');
            if (equals > 0) {
                directives.put(text.substring(0, equals).trim().toLowerCase(), text.substring(equals + 1).trim());
            }
            last = directive;
        }
        ConcreteNode closing = findToken(node, ")");
        Block body = null;
        if (closing != null) {
            for (ConcreteNode child : node.children()) {
                if (child.startByte() < closing.endByte() || child == closing) continue;
                if (!child.isNamed() && ":".equals(child.kind())) {
                    body = colonBody(node, child);
                    break;
                }
                if (child.isNamed() && child != last && child.grammarKind() != GrammarKind.COMMENT) {
                    body = block(child);
                    break;
                }
            }
        }
        return new DeclareStatement(context.span(node), directives, body);
    }

    private ConcreteNode firstSignificant(ConcreteNode node) {
        List<ConcreteNode> children = significantChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    private List<Expression> mapAll(List<ConcreteNode> nodes) {
        List<Expression> result = new ArrayList<>();
        for (ConcreteNode node : nodes) {
            result.add(pass.expressions.map(node));
        }
        return result;
    }

    private List<Expression> mapSequences(List<ConcreteNode> nodes) {
        List<Expression> result = new ArrayList<>();
        for (ConcreteNode node : nodes) {
            result.addAll(pass.expressions.mapSequence(node));
        }
        return result;
    }
}
