package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.FakeConcreteNode;
import org.dxworks.celerrate.cst.SourceText;
import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.diagnostics.Severity;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.DialectSelection;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.celerrate.cst.FakeConcreteNode.*;
import static org.junit.jupiter.api.Assertions.*;

public class NodeMapperTest {
    private final NodeMapper mapper = new NodeMapper();

    private static FakeConcreteNode variableStatement(int start) {
        return node("expression_statement", start, start + 3,
                node("variable_name", start, start + 2, token("$", start), node("name", start + 1, start + 2)),
                token(";", start + 2));
    }

    @Test
    void map_brokenStatementBetweenValidOnes() {
        SourceText source = new SourceText("<?php $a; ??? $b;");
        FakeConcreteNode root = node("program", 0, 17,
                node("php_tag", 0, 5),
                variableStatement(6),
                node("ERROR", 10, 13),
                variableStatement(14));

        MappingResult result = mapper.map(root, source, Dialect.PHP_8_1);

        List<AstNode> statements = result.getRoot().statements;
        assertEquals(3, statements.size());
        assertEquals("a", ((Variable) ((ExpressionStatement) statements.get(0)).expression).name);
        assertTrue(statements.get(1) instanceof UnknownStatement);
        assertEquals("ERROR", ((UnknownStatement) statements.get(1)).getConcreteKind());
        assertEquals("b", ((Variable) ((ExpressionStatement) statements.get(2)).expression).name);

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic error = result.getDiagnostics().get(0);
        assertEquals(Severity.ERROR, error.getSeverity());
        assertEquals(DiagnosticCode.SYNTAX_ERROR, error.getCode());
        assertEquals(statements.get(1).getSpan(), error.getSpan());
        assertEquals(List.of(statements.get(1)), result.getUnknownNodes());
    }

    @Test
    void map_unknownGrammarKindInStatementAndExpressionSlots() {
        SourceText source = new SourceText("<?php $x |> f; zzz");
        FakeConcreteNode root = node("program", 0, 18,
                node("php_tag", 0, 5),
                node("expression_statement", 6, 14, node("pipe_expression", 6, 13), token(";", 13)),
                node("pipe_statement", 15, 18));

        MappingResult result = mapper.map(root, source, Dialect.PHP_8_4);

        ExpressionStatement first = (ExpressionStatement) result.getRoot().statements.get(0);
        assertTrue(first.expression instanceof UnknownExpression);
        assertTrue(result.getRoot().statements.get(1) instanceof UnknownStatement);
        assertEquals(2, result.getDiagnostics().size());
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            assertEquals(DiagnosticCode.UNKNOWN_GRAMMAR_KIND, diagnostic.getCode());
            assertEquals(Severity.WARNING, diagnostic.getSeverity());
        }
        assertFalse(result.hasErrors());
        assertTrue(result.failures(ReportingMode.LENIENT).isEmpty());
        assertEquals(2, result.failures(ReportingMode.STRICT).size());
    }

    @Test
    void map_missingNodeReportedOnce() {
        SourceText source = new SourceText("<?php $a");
        FakeConcreteNode statement = node("expression_statement", 6, 8,
                node("variable_name", 6, 8, token("$", 6), node("name", 7, 8)),
                missing(";", 8));
        FakeConcreteNode root = node("program", 0, 8, node("php_tag", 0, 5), statement);

        MappingResult result = mapper.map(root, source, Dialect.PHP_8_1);

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticCode.MISSING_NODE, result.getDiagnostics().get(0).getCode());
        assertTrue(result.getRoot().statements.get(0) instanceof ExpressionStatement);
    }

    @Test
    void map_fallbackDialectIsReportedAtStartOfFile() {
        SourceText source = new SourceText("<?php $a;");
        FakeConcreteNode root = node("program", 0, 9, node("php_tag", 0, 5), variableStatement(6));

        MappingResult result = mapper.map(root, source, new DialectSelection("9.0", Dialect.latest(), true));

        assertEquals(Dialect.latest(), result.getDialect());
        assertEquals(1, result.getDiagnostics().size());
        Diagnostic fallback = result.getDiagnostics().get(0);
        assertEquals(DiagnosticCode.DIALECT_FALLBACK, fallback.getCode());
        assertEquals(0, fallback.getSpan().getStartOffset());
        assertTrue(fallback.getSpan().isEmpty());
    }

    @Test
    void map_emptyProgramGivesEmptyFile() {
        MappingResult result = mapper.map(node("program", 0, 0), new SourceText(""), Dialect.PHP_7_0);

        assertTrue(result.getRoot().statements.isEmpty());
        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals(0, result.getRoot().getSpan().length());
    }

    @Test
    void map_excessiveNestingFailsOnlyThisCall() {
        int depth = 200_000;
        SourceText source = new SourceText("x");
        FakeConcreteNode root = node("program", 0, 1);
        FakeConcreteNode statement = node("expression_statement", 0, 1);
        root.add(null, statement);
        FakeConcreteNode current = statement;
        for (int i = 0; i < depth; i++) {
            FakeConcreteNode next = node("parenthesized_expression", 0, 1);
            current.add(null, next);
            current = next;
        }

        assertThrows(InvariantViolationException.class, () -> mapper.map(root, source, Dialect.PHP_8_1));

        MappingResult next = mapper.map(node("program", 0, 0), new SourceText(""), Dialect.PHP_8_1);
        assertNotNull(next.getRoot());
    }

    @Test
    void map_contractBreachIsFatal() {
        FakeConcreteNode root = node("program", 0, 20, node("text", 0, 20));

        assertThrows(InvariantViolationException.class,
                () -> mapper.map(root, new SourceText("short"), Dialect.PHP_8_1));
    }

    @Test
    void map_brokenSwitchCaseKeptInSourceOrder() {
        SourceText source = new SourceText("<?php switch ($a) { case 1: ??? default: }");
        FakeConcreteNode subject = node("parenthesized_expression", 13, 17,
                token("(", 13),
                node("variable_name", 14, 16, token("$", 14), node("name", 15, 16)),
                token(")", 16));
        FakeConcreteNode block = node("switch_block", 18, 42,
                token("{", 18),
                node("case_statement", 20, 27, token("case", 20), node("integer", 25, 26), token(":", 26)),
                node("ERROR", 28, 31),
                node("default_statement", 32, 40, token("default", 32), token(":", 39)),
                token("}", 41));
        FakeConcreteNode root = node("program", 0, 42,
                node("php_tag", 0, 5),
                node("switch_statement", 6, 42, token("switch", 6))
                        .withField("condition", subject)
                        .withField("body", block));

        MappingResult result = mapper.map(root, source, Dialect.PHP_8_1);

        SwitchStatement statement = (SwitchStatement) result.getRoot().statements.get(0);
        assertEquals(2, statement.cases.size());
        assertEquals(1, statement.malformed.size());
        UnknownStatement broken = statement.malformed.get(0);
        assertEquals("ERROR", broken.getConcreteKind());

        List<AstNode> children = statement.getChildren();
        assertEquals(4, children.size());
        assertTrue(children.get(0) instanceof Variable);
        assertSame(statement.cases.get(0), children.get(1));
        assertSame(broken, children.get(2));
        assertSame(statement.cases.get(1), children.get(3));

        assertEquals(List.of(broken), result.getUnknownNodes());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticCode.SYNTAX_ERROR, result.getDiagnostics().get(0).getCode());
        assertEquals(broken.getSpan(), result.getDiagnostics().get(0).getSpan());
    }

    @Test
    void map_brokenMatchArmKeptInSourceOrder() {
        SourceText source = new SourceText("<?php match ($a) { 1 => 2, ??? default => 3 };");
        FakeConcreteNode subject = node("parenthesized_expression", 12, 16,
                token("(", 12),
                node("variable_name", 13, 15, token("$", 13), node("name", 14, 15)),
                token(")", 15));
        FakeConcreteNode block = node("match_block", 17, 45,
                token("{", 17),
                node("match_conditional_expression", 19, 25,
                        node("match_condition_list", 19, 20, node("integer", 19, 20)),
                        token("=>", 21),
                        node("integer", 24, 25)),
                token(",", 25),
                node("ERROR", 27, 30),
                node("match_default_expression", 31, 43,
                        token("default", 31), token("=>", 39), node("integer", 42, 43)),
                token("}", 44));
        FakeConcreteNode root = node("program", 0, 46,
                node("php_tag", 0, 5),
                node("expression_statement", 6, 46,
                        node("match_expression", 6, 45, token("match", 6))
                                .withField("condition", subject)
                                .withField("body", block),
                        token(";", 45)));

        MappingResult result = mapper.map(root, source, Dialect.PHP_8_1);

        ExpressionStatement statement = (ExpressionStatement) result.getRoot().statements.get(0);
        MatchExpression match = (MatchExpression) statement.expression;
        assertEquals(2, match.arms.size());
        assertEquals(1, match.malformed.size());
        assertTrue(match.arms.get(1).isDefault);
        assertEquals(3L, ((IntegerLiteral) match.arms.get(1).body).value);

        List<AstNode> children = match.getChildren();
        assertEquals(4, children.size());
        assertSame(match.malformed.get(0), children.get(2));
        assertEquals(List.of(match.malformed.get(0)), result.getUnknownNodes());
        assertEquals(DiagnosticCode.SYNTAX_ERROR, result.getDiagnostics().get(0).getCode());
    }
}
