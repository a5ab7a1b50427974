package com.e2eq.conformance.turtle;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TurtleExtractorTest {

    private static final String BODY = "@prefix ex: <http://example.com/> .\nex:a ex:b ex:c .";

    @Test
    void testStripsTurtleFenceAndCommentary() {
        String raw = "Here is the policy you asked for:\n\n```turtle\n" + BODY + "\n```\nLet me know if it needs changes.";
        String out = TurtleExtractor.extract(raw);
        assertEquals(BODY, out);
    }

    @Test
    void testStripsPlainFence() {
        assertEquals(BODY, TurtleExtractor.extract("```\n" + BODY + "\n```"));
    }

    @Test
    void testUnterminatedFenceIsRemoved() {
        assertEquals(BODY, TurtleExtractor.extract("```turtle\n" + BODY));
    }

    @Test
    void testCommentaryBeforePrefixIsDropped() {
        assertEquals(BODY, TurtleExtractor.extract("Sure.\nThe policy follows.\n" + BODY));
    }

    @Test
    void testTextWithoutPrefixIsOnlyTrimmed() {
        assertEquals("ex:a ex:b ex:c .", TurtleExtractor.extract("  ex:a ex:b ex:c .  \n"));
    }

    @Test
    void testNullAndBlankYieldEmpty() {
        assertEquals("", TurtleExtractor.extract(null));
        assertEquals("", TurtleExtractor.extract("  \n "));
    }
}
