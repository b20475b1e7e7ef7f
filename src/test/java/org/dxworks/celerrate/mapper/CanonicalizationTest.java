package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.Celerrate;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalizationTest {

    private static SourceFile map(String source) {
        MappingResult result = Celerrate.map(source, Dialect.PHP_8_3);
        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        return result.getRoot();
    }

    @Test
    void map_bodySpellingsAreEqual() {
        SourceFile braces = map("<?php\nif ($a) { foo(); }\n");
        SourceFile single = map("<?php\nif ($a) foo();\n");
        SourceFile alternative = map("<?php\nif ($a): foo(); endif;\n");

        assertEquals(braces, single);
        assertEquals(braces, alternative);
        IfStatement statement = (IfStatement) braces.statements.get(0);
        assertEquals(1, statement.thenBlock.statements.size());
    }

    @Test
    void map_elseIfSpellingsAreEqual() {
        SourceFile joined = map("<?php\nif ($a) { x(); } elseif ($b) { y(); } else { z(); }\n");
        SourceFile split = map("<?php\nif ($a) { x(); } else if ($b) { y(); } else { z(); }\n");

        assertEquals(joined, split);
        IfStatement statement = (IfStatement) split.statements.get(0);
        assertEquals(1, statement.elseIfs.size());
        assertNotNull(statement.elseBlock);
    }

    @Test
    void map_loopBodySpellingsAreEqual() {
        SourceFile braces = map("<?php\nwhile ($i) { $i--; }\n");
        SourceFile alternative = map("<?php\nwhile ($i): $i--; endwhile;\n");

        assertEquals(braces, alternative);
    }

    @Test
    void map_listSpellingsAreEqual() {
        SourceFile longForm = map("<?php\nlist($a, $b) = $pair;\n");
        SourceFile shortForm = map("<?php\n[$a, $b] = $pair;\n");

        assertEquals(longForm, shortForm);
        Assignment assignment = (Assignment) ((ExpressionStatement) shortForm.statements.get(0)).expression;
        assertTrue(assignment.target instanceof ListDestructure);
    }

    @Test
    void map_isIdempotent() {
        String source = "<?php\nforeach ($items as $key => $value) { echo $key, $value; }\n";

        assertEquals(map(source), map(source));
    }

    @Test
    void map_unbracedNamespaceOwnsFollowingStatements() {
        SourceFile unbraced = map("<?php\nnamespace App;\nfunction f() {}\n");
        SourceFile braced = map("<?php\nnamespace App {\nfunction f() {}\n}\n");

        assertEquals(unbraced, braced);
        NamespaceDeclaration namespace = (NamespaceDeclaration) unbraced.statements.get(0);
        assertEquals("App", namespace.name);
        assertEquals(1, namespace.statements.size());
    }

    @Test
    void map_shortEchoTagEqualsEcho() {
        SourceFile shortTag = map("<?= $y ?>");
        SourceFile echo = map("<?php echo $y ?>");

        assertEquals(echo, shortTag);
        EchoStatement statement = (EchoStatement) shortTag.statements.get(0);
        assertEquals("y", ((Variable) statement.values.get(0)).name);
    }

    @Test
    void map_shortEchoTagInsideMarkup() {
        SourceFile file = map("<?php $a = 1; ?>\n<b><?= $a ?></b>");

        assertEquals(1, AstTraversal.findAll(file, EchoStatement.class).size());
        assertEquals(1, AstTraversal.findAll(file, ExpressionStatement.class).size());
        assertFalse(AstTraversal.findAll(file, InlineHtml.class).isEmpty());
    }
}
