package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.PhpGrammar;
import org.dxworks.celerrate.cst.SourceText;
import org.dxworks.celerrate.dialect.Ambiguity;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.DialectResolver;
import org.dxworks.celerrate.dialect.InterpretationChoice;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AmbiguityReadingTest {

    private static SourceFile map(NodeMapper mapper, String code) {
        SourceText source = new SourceText(code);
        MappingResult result = mapper.map(PhpGrammar.parse(source), source, Dialect.PHP_8_3);
        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        return result.getRoot();
    }

    private static NodeMapper asWritten(Ambiguity ambiguity) {
        return new NodeMapper(DialectResolver.getDefault().withReading(ambiguity, InterpretationChoice.AS_WRITTEN));
    }

    private static Block thenBlock(SourceFile file) {
        return ((IfStatement) file.statements.get(0)).thenBlock;
    }

    private static Expression assigned(SourceFile file, boolean left) {
        Assignment assignment = (Assignment) ((ExpressionStatement) file.statements.get(0)).expression;
        return left ? assignment.target : assignment.value;
    }

    @Test
    void map_bodyAsWrittenKeepsSpelling() {
        NodeMapper mapper = asWritten(Ambiguity.STATEMENT_BODY);
        SourceFile braces = map(mapper, "<?php\nif ($a) { foo(); }\n");
        SourceFile single = map(mapper, "<?php\nif ($a) foo();\n");

        assertNotEquals(braces, single);
        assertEquals("braces", thenBlock(braces).spelling);
        assertEquals("statement", thenBlock(single).spelling);
        assertEquals(1, thenBlock(single).statements.size());
    }

    @Test
    void map_alternativeSyntaxAsWrittenKeepsSpelling() {
        NodeMapper mapper = asWritten(Ambiguity.ALTERNATIVE_SYNTAX);
        SourceFile colon = map(mapper, "<?php\nif ($a): foo(); endif;\n");
        SourceFile braces = map(mapper, "<?php\nif ($a) { foo(); }\n");

        assertEquals("colon", thenBlock(colon).spelling);
        assertNotEquals(braces, colon);
    }

    @Test
    void map_arrayAsWrittenKeepsSpelling() {
        NodeMapper mapper = asWritten(Ambiguity.ARRAY_SPELLING);
        SourceFile longForm = map(mapper, "<?php\n$a = array(1, 2);\n");
        SourceFile shortForm = map(mapper, "<?php\n$a = [1, 2];\n");

        assertNotEquals(longForm, shortForm);
        assertEquals("array", ((ArrayLiteral) assigned(longForm, false)).spelling);
        assertEquals("short", ((ArrayLiteral) assigned(shortForm, false)).spelling);
    }

    @Test
    void map_listAsWrittenKeepsSpelling() {
        NodeMapper mapper = asWritten(Ambiguity.LIST_SPELLING);
        SourceFile longForm = map(mapper, "<?php\nlist($a, $b) = $pair;\n");
        SourceFile shortForm = map(mapper, "<?php\n[$a, $b] = $pair;\n");

        assertNotEquals(longForm, shortForm);
        assertEquals("list", ((ListDestructure) assigned(longForm, true)).spelling);
        assertEquals("short", ((ListDestructure) assigned(shortForm, true)).spelling);
    }

    @Test
    void map_defaultReadingDropsSpelling() {
        NodeMapper mapper = new NodeMapper();
        SourceFile braces = map(mapper, "<?php\nif ($a) { $x = array(1); }\n");
        SourceFile single = map(mapper, "<?php\nif ($a) $x = [1];\n");

        assertEquals(braces, single);
        assertNull(thenBlock(braces).spelling);
    }
}
