package com.gmlparser;

import com.gmlparser.ast.*;
import com.gmlparser.diagnostics.GmlSyntaxError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class GmlParserTest {

    @Test
    void testParseReturnsProgram() {
        Program program = GmlParser.parse("x = 1;\ny = x + 2;");
        assertEquals("Program", program.type());
        assertEquals(2, program.body().size());
    }

    @Test
    void testTryParseSuccess() {
        ParseResult result = GmlParser.tryParse("x = 1; // one");
        assertTrue(result.isSuccess());
        ParseResult.Success success = (ParseResult.Success) result;
        assertEquals(1, success.comments().size());
        assertEquals(3, success.whitespaces().size());
        assertTrue(success.scopes().isEmpty());
    }

    @Test
    void testTryParseFailure() {
        ParseResult result = GmlParser.tryParse("x = ;");
        assertFalse(result.isSuccess());
        GmlSyntaxError error = ((ParseResult.Failure) result).error();
        assertEquals("SyntaxError", error.getName());
        assertEquals(1, error.getLine());
        assertEquals(4, error.getColumn());
    }

    @Test
    void testParseThrowsSyntaxError() {
        assertThrows(GmlSyntaxError.class, () -> GmlParser.parse("x = ;"));
    }

    @Test
    void testNullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> GmlParser.parse(null));
        assertThrows(NullPointerException.class, () -> GmlParser.parse("x = 1;", null));
    }

    @Test
    void testCommentsAttachedByDefault() {
        Program program = GmlParser.parse("// note\nx = 1;");
        assertEquals(1, program.comments().size());
        assertEquals(" note", program.comments().get(0).value());
    }

    @Test
    void testCommentsCanBeLeftOff() {
        ParserOptions options = ParserOptions.defaults().withComments(false);
        ParseResult.Success result = (ParseResult.Success) GmlParser.tryParse("// note\nx = 1;", options);
        assertTrue(result.program().comments().isEmpty());
        assertEquals(1, result.comments().size(), "the side list is always filled");
    }

    @Test
    @DisplayName("Positions after a rewritten condition refer to the original text")
    void testSanitizedPositionsAreMappedBack() {
        String source = "if (a = b) { x = 1; }";
        Program program = GmlParser.parse(source);
        assertEquals(20, program.end().index());

        IfStatement statement = (IfStatement) program.body().get(0);
        ParenthesizedExpression test = (ParenthesizedExpression) statement.test();
        BinaryExpression comparison = (BinaryExpression) test.expression();
        assertEquals("==", comparison.operator());
        assertEquals(4, comparison.start().index());
        assertEquals(source.indexOf('b'), comparison.right().start().index());

        AssignmentExpression body = (AssignmentExpression) ((BlockStatement) statement.consequent()).body().get(0);
        assertEquals(source.indexOf('x'), body.left().start().index());
    }

    @Test
    void testSanitizedCommentPositionsAreMappedBack() {
        String source = "if (a = b) { } // done";
        ParseResult.Success result = (ParseResult.Success) GmlParser.tryParse(source);
        assertEquals(source.indexOf("//"), result.comments().get(0).start().index());
        assertEquals(source.length() - 1, result.comments().get(0).end().index());
    }

    @Test
    void testSyntaxErrorAfterRewrittenConditionReportsOriginalColumn() {
        String source = "if (a = b) { x = ; }";
        GmlSyntaxError e = assertThrows(GmlSyntaxError.class, () -> GmlParser.parse(source));
        assertEquals(1, e.getLine());
        assertEquals(source.indexOf(';'), e.getColumn());
        assertTrue(e.getMessage().startsWith("Syntax Error (line 1, column 17): "), e.getMessage());

        GmlSyntaxError nextLine = assertThrows(GmlSyntaxError.class,
            () -> GmlParser.parse("if (a = b) {\n  y = ;\n}"));
        assertEquals(2, nextLine.getLine());
        assertEquals(6, nextLine.getColumn());
    }

    @Test
    void testRepeatedIdentifierDoesNotSlowParsing() {
        String source = "i = i + 1;\n".repeat(30_000);
        Program program = assertTimeout(Duration.ofSeconds(10), () -> GmlParser.parse(source));
        assertEquals(30_000, program.body().size());
    }

    @Test
    void testSanitizingCanBeTurnedOff() {
        ParserOptions options = ParserOptions.defaults().withSanitizeConditionalAssignments(false);
        assertFalse(GmlParser.tryParse("if (a = b) {}", options).isSuccess());
        assertTrue(GmlParser.tryParse("if (a == b) {}", options).isSuccess());
    }

    @Test
    void testEveryParseStartsFresh() {
        ParserOptions options = ParserOptions.defaults().withScopeTracking(true);
        ParseResult.Success first = (ParseResult.Success) GmlParser.tryParse("globalvar g;", options);
        ParseResult.Success second = (ParseResult.Success) GmlParser.tryParse("x = g;", options);
        assertEquals("scope-0", first.scopes().get(0).scopeId());
        Identifier g = (Identifier) ((AssignmentExpression) second.program().body().get(0)).right();
        assertFalse(g.isGlobalIdentifier());
        assertNull(g.declaration());
    }

    // ==================== ParserOptions ====================

    @Test
    void testDefaultOptions() {
        ParserOptions options = ParserOptions.defaults();
        assertTrue(options.getComments());
        assertTrue(options.sanitizeConditionalAssignments());
        assertFalse(options.scopeTracking());
        assertEquals(512, options.maxNestingDepth());
    }

    @Test
    void testWithMethodsCopy() {
        ParserOptions defaults = ParserOptions.defaults();
        ParserOptions changed = defaults.withScopeTracking(true).withMaxNestingDepth(64);
        assertTrue(changed.scopeTracking());
        assertEquals(64, changed.maxNestingDepth());
        assertFalse(defaults.scopeTracking());
        assertEquals(new ParserOptions(true, true, true, 64), changed);
    }

    @Test
    void testNestingDepthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.defaults().withMaxNestingDepth(0));
        assertThrows(IllegalArgumentException.class, () -> new ParserOptions(true, true, false, -1));
    }
}
