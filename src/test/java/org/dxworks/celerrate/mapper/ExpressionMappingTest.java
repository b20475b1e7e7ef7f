package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.Celerrate;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionMappingTest {

    private static MappingResult map(String source, Dialect dialect) {
        MappingResult result = Celerrate.map(source, dialect);
        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        return result;
    }

    private static String assignedString(MappingResult result) {
        Assignment assignment = (Assignment) ((ExpressionStatement) result.getRoot().statements.get(0)).expression;
        return ((StringLiteral) assignment.value).value;
    }

    @Test
    void map_yieldForms() {
        MappingResult result = map("<?php\nfunction g() {\n    yield 1;\n    yield 'k' => 2;\n    yield from h();\n}\n",
                Dialect.PHP_8_2);

        List<YieldExpression> yields = AstTraversal.findAll(result.getRoot(), YieldExpression.class);
        assertEquals(3, yields.size());

        assertNull(yields.get(0).key);
        assertEquals(1L, ((IntegerLiteral) yields.get(0).value).value);
        assertFalse(yields.get(0).delegate);

        assertEquals("k", ((StringLiteral) yields.get(1).key).value);
        assertEquals(2L, ((IntegerLiteral) yields.get(1).value).value);

        assertTrue(yields.get(2).delegate);
        assertTrue(yields.get(2).value instanceof FunctionCall);
    }

    @Test
    void map_heredocClosingIndentStrippedFromPhp73() {
        String source = "<?php\n$s = <<<EOT\n  hello\n  EOT;\n";

        assertEquals("hello", assignedString(map(source, Dialect.PHP_8_2)));
        assertEquals("hello", assignedString(map(source, Dialect.PHP_7_3)));
        assertEquals("  hello", assignedString(map(source, Dialect.PHP_7_2)));
    }

    @Test
    void map_heredocIndentKeepsDeeperLines() {
        String source = "<?php\n$s = <<<EOT\n    a\n      b\n    EOT;\n";

        assertEquals("a\n  b", assignedString(map(source, Dialect.PHP_8_2)));
    }

    @Test
    void map_nowdocClosingIndentStripped() {
        String source = "<?php\n$s = <<<'EOT'\n  hello\n  EOT;\n";

        assertEquals("hello", assignedString(map(source, Dialect.PHP_8_2)));
    }
}
