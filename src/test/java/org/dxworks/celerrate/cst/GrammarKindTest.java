package org.dxworks.celerrate.cst;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarKindTest {

    @Test
    void fromTag_mapsGrammarTags() {
        assertEquals(GrammarKind.CLASS_DECLARATION, GrammarKind.fromTag("class_declaration"));
        assertEquals(GrammarKind.ERROR, GrammarKind.fromTag("ERROR"));
        assertEquals(GrammarKind.NULL, GrammarKind.fromTag("null"));
    }

    @Test
    void fromTag_unknownTagsFallToUnknown() {
        assertEquals(GrammarKind.UNKNOWN, GrammarKind.fromTag("pipe_expression"));
        assertEquals(GrammarKind.UNKNOWN, GrammarKind.fromTag(null));
        assertNull(GrammarKind.UNKNOWN.getTag());
    }
}
