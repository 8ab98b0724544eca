package com.gmlparser.sanitize;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConditionalAssignmentSanitizerTest {

    private static void assertUnchanged(String source) {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize(source);
        assertFalse(result.isModified(), "should not rewrite: " + source);
        assertNull(result.indexAdjustments());
        assertEquals(source, result.text());
    }

    @Test
    void testAssignmentInConditionBecomesEquality() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if (a = b) { x = 1; }");
        assertTrue(result.isModified());
        assertEquals("if (a == b) { x = 1; }", result.text());
        assertEquals(List.of(7), result.indexAdjustments());
    }

    @Test
    void testEveryConditionIsRewritten() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if (a = 1) {} if (b = 2) {}");
        assertEquals("if (a == 1) {} if (b == 2) {}", result.text());
        assertEquals(List.of(7, 22), result.indexAdjustments());
    }

    @Test
    void testKeywordIsCaseInsensitive() {
        assertEquals("IF (a == b) {}", ConditionalAssignmentSanitizer.sanitize("IF (a = b) {}").text());
    }

    @Test
    void testNestedParentheses() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if ((a = b) && c) {}");
        assertEquals("if ((a == b) && c) {}", result.text());
        assertEquals(List.of(8), result.indexAdjustments());

        assertUnchanged("if (f(x)) y = 1;");
    }

    @Test
    void testCompoundOperatorsAreLeftAlone() {
        assertUnchanged("if (a == b) {}");
        assertUnchanged("if (a <= b) {}");
        assertUnchanged("if (a >= b) {}");
        assertUnchanged("if (a != b) {}");
        assertUnchanged("if (a := b) {}");
    }

    @Test
    void testAssignmentsOutsideConditionsAreLeftAlone() {
        assertUnchanged("x = 1;");
        assertUnchanged("if x > 1 then y = 2;");
        assertUnchanged("gif(a = b);");
        assertUnchanged("iff(a = b);");
    }

    @Test
    void testStringsAreCopiedVerbatim() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if (s = \"=\") {}");
        assertEquals("if (s == \"=\") {}", result.text());
        assertEquals(List.of(7), result.indexAdjustments());

        assertUnchanged("if (s == 'a = b') {}");
        assertUnchanged("if (s == `a = b`) {}");
        assertUnchanged("if (s == \"a \\\" = b\") {}");
    }

    @Test
    void testCommentsAreCopiedVerbatim() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if (/* = */ a = b) {}");
        assertEquals("if (/* = */ a == b) {}", result.text());
        assertEquals(List.of(15), result.indexAdjustments());

        assertUnchanged("// if (a = b)\nx = 1;");
        assertUnchanged("/* if (a = b) */ x = 1;");
    }

    @Test
    void testEmptyInput() {
        assertUnchanged("");
    }

    @Test
    void testMapperUndoesInsertions() {
        SanitizedSource result = ConditionalAssignmentSanitizer.sanitize("if (a = b) { x = 1; }");
        IndexMapper mapper = result.indexMapper();
        int bInSanitized = result.text().indexOf('b');
        assertEquals("if (a = b) { x = 1; }".indexOf('b'), mapper.map(bInSanitized));
    }
}
