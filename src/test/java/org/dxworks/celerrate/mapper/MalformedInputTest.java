package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.Celerrate;
import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MalformedInputTest {

    private static final List<String> BROKEN_SOURCES = List.of(
            "<?php\n$a = 1;\n$b = ;\n$c = 3;\n",
            "<?php\nswitch ($a) {\n    case 1: foo(); break;\n    ???\n    default: bar();\n}\n",
            "<?php\n$r = match ($a) {\n    1 => 'one',\n    ???\n    default => 'other',\n};\n",
            "<?php\nfunction f( {\n",
            "<?php\nclass A {\n    public function\n}\n",
            "<?php\nclass A {\n    public function f() {\n        if ($x\n",
            "<?php\nforeach ($xs as ) { echo $x; }\n$y = 2;\n",
            "<?php\nif ($a {\n    foo();\n}\n",
            "<?php\n$x = new ;\n$y = 1;\n");

    private static void assertEveryPlaceholderExplained(MappingResult result) {
        for (AstNode unknown : result.getUnknownNodes()) {
            boolean explained = result.getDiagnostics().stream()
                    .anyMatch(diagnostic -> unknown.getSpan().contains(diagnostic.getSpan()));
            assertTrue(explained, () -> "no diagnostic inside " + unknown + " among " + result.getDiagnostics());
        }
    }

    @Test
    void map_statementWithMissingValueBecomesPlaceholder() {
        MappingResult result = Celerrate.map("<?php\n$a = 1;\n$b = ;\n$c = 3;\n", Dialect.PHP_8_2);
        List<AstNode> statements = result.getRoot().statements;

        Assignment first = (Assignment) ((ExpressionStatement) statements.get(0)).expression;
        assertEquals("a", ((Variable) first.target).name);
        assertEquals(1L, ((IntegerLiteral) first.value).value);

        assertTrue(result.hasErrors());
        assertFalse(result.getUnknownNodes().isEmpty());
        for (Assignment assignment : AstTraversal.findAll(result.getRoot(), Assignment.class)) {
            assertFalse(assignment.value instanceof Assignment, "error swallowed into " + assignment);
        }

        Diagnostic syntaxError = result.getDiagnostics().stream()
                .filter(diagnostic -> diagnostic.getCode() == DiagnosticCode.SYNTAX_ERROR)
                .findFirst()
                .orElseThrow();
        assertTrue(result.getUnknownNodes().stream().anyMatch(node -> node.getSpan().contains(syntaxError.getSpan())));
    }

    @Test
    void map_everySyntaxErrorLandsInPlaceholder() {
        for (String source : BROKEN_SOURCES) {
            MappingResult result = Celerrate.map(source, Dialect.PHP_8_2);

            for (Diagnostic diagnostic : result.getDiagnostics()) {
                if (diagnostic.getCode() != DiagnosticCode.SYNTAX_ERROR) continue;
                assertTrue(result.getUnknownNodes().stream().anyMatch(node -> node.getSpan().contains(diagnostic.getSpan())),
                        () -> "syntax error " + diagnostic + " not covered in " + AstPrinter.print(result.getRoot()));
            }
        }
    }

    @Test
    void map_everyPlaceholderCarriesDiagnostic() {
        for (String source : BROKEN_SOURCES) {
            MappingResult result = Celerrate.map(source, Dialect.PHP_8_2);

            assertTrue(result.hasErrors(), source);
            assertEveryPlaceholderExplained(result);
        }
    }

    @Test
    void map_rejectedConstructsCarryDiagnostic() {
        MappingResult result = Celerrate.map("<?php\nenum Suit { case Hearts; }\n$r = match ($a) { 1 => 2 };\n", Dialect.PHP_7_4);

        assertEquals(2, result.getUnknownNodes().size());
        assertEveryPlaceholderExplained(result);
    }
}
