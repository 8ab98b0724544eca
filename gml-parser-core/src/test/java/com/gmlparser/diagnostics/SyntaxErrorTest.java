package com.gmlparser.diagnostics;

import com.gmlparser.GmlParser;
import com.gmlparser.ParserOptions;
import com.gmlparser.grammar.GameMakerLanguageParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxErrorTest {

    private static GmlSyntaxError parseError(String source) {
        return assertThrows(GmlSyntaxError.class, () -> GmlParser.parse(source));
    }

    @Test
    @DisplayName("Unfinished if condition reports end of file in expression")
    void testUnfinishedCondition() {
        GmlSyntaxError e = parseError("if (");
        assertEquals("Syntax Error (line 1, column 4): unexpected end of file in expression", e.getMessage());
        assertEquals("SyntaxError", e.getName());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertEquals("end of file", e.getWrongSymbol());
        assertEquals("<EOF>", e.getOffendingText());
        assertEquals("expression", e.getRule());
    }

    @Test
    void testMissingClosingBracePointsAtOpeningBrace() {
        GmlSyntaxError e = parseError("x = 0;\n  {\n  x = 1;\n");
        assertEquals("Syntax Error (line 2, column 2): missing associated closing brace for this block", e.getMessage());
        assertEquals("closeBlock", e.getRule());
    }

    @Test
    void testIncrementOfNonVariable() {
        GmlSyntaxError e = parseError("++5;");
        assertEquals("Syntax Error (line 1, column 2): ++, -- can only be used on a variable-addressing expression",
            e.getMessage());

        e = parseError("(a+b)++;");
        assertEquals("Syntax Error (line 1, column 0): ++, -- can only be used on a variable-addressing expression",
            e.getMessage());
        assertEquals("lValueExpression", e.getRule());

        e = parseError("++f();");
        assertEquals("Syntax Error (line 1, column 2): ++, -- can only be used on a variable-addressing expression",
            e.getMessage());

        e = parseError("x = --g(1);");
        assertEquals("Syntax Error (line 1, column 6): ++, -- can only be used on a variable-addressing expression",
            e.getMessage());
    }

    @Test
    void testBadParameter() {
        GmlSyntaxError e = parseError("function f(1) {}");
        assertEquals("Syntax Error (line 1, column 11): unexpected symbol '1' in function parameters, expected an identifier",
            e.getMessage());
    }

    @Test
    void testStrayTokenAtProgramLevel() {
        GmlSyntaxError e = parseError("x = 1;\n)");
        assertEquals("Syntax Error (line 2, column 0): unexpected symbol ')'", e.getMessage());
    }

    @Test
    void testGenericMessageNamesTheRule() {
        GmlSyntaxError e = parseError("var = 5;");
        assertEquals("Syntax Error (line 1, column 4): unexpected symbol '=' while matching rule identifier",
            e.getMessage());
    }

    @Test
    void testLexerError() {
        GmlSyntaxError e = parseError("x = `;");
        assertEquals("Syntax Error (line 1, column 4): unexpected symbol '`'", e.getMessage());
        assertNull(e.getRule());
        assertEquals("`", e.getOffendingText());
    }

    @Test
    void testNestingDepthLimit() {
        String source = "x = " + "(".repeat(40) + "1" + ")".repeat(40) + ";";
        GmlSyntaxError e = assertThrows(GmlSyntaxError.class,
            () -> GmlParser.parse(source, ParserOptions.defaults().withMaxNestingDepth(20)));
        assertTrue(e.getMessage().startsWith("Syntax Error (line 1, column "), e.getMessage());
        assertTrue(e.getMessage().endsWith(GameMakerLanguageParser.NESTING_DEPTH_EXCEEDED), e.getMessage());

        // Same source is fine under the default limit
        assertDoesNotThrow(() -> GmlParser.parse(source));
    }

    @Test
    void testDeepButRealisticNestingParses() {
        String calls = "x = " + "f(".repeat(200) + "1" + ")".repeat(200) + ";";
        assertDoesNotThrow(() -> GmlParser.parse(calls));

        String blocks = "if (a) {\n".repeat(150) + "x = 1;\n" + "}\n".repeat(150);
        assertDoesNotThrow(() -> GmlParser.parse(blocks));
    }

    @Test
    void testNestingLimitCountsBracketsNotRules() {
        // Each call level opens one parenthesis
        String source = "x = " + "f(".repeat(10) + "1" + ")".repeat(10) + ";";
        assertDoesNotThrow(() -> GmlParser.parse(source, ParserOptions.defaults().withMaxNestingDepth(10)));
        GmlSyntaxError e = assertThrows(GmlSyntaxError.class,
            () -> GmlParser.parse(source, ParserOptions.defaults().withMaxNestingDepth(9)));
        assertEquals(1, e.getLine());
        assertEquals(23, e.getColumn());
        assertTrue(e.getMessage().endsWith(GameMakerLanguageParser.NESTING_DEPTH_EXCEEDED), e.getMessage());
    }

    @Test
    void testPathologicalNestingIsASyntaxError() {
        String source = "x = " + "(".repeat(5000) + "1" + ")".repeat(5000) + ";";
        GmlSyntaxError e = assertThrows(GmlSyntaxError.class, () -> GmlParser.parse(source));
        assertTrue(e.getMessage().contains(GameMakerLanguageParser.NESTING_DEPTH_EXCEEDED), e.getMessage());
    }

    @Test
    void testFormatting() {
        assertEquals("l value expression", SyntaxErrorFormatter.formatRuleName("lValueExpression"));
        assertEquals("unknown", SyntaxErrorFormatter.formatRuleName(null));
        assertEquals("symbol ';'", SyntaxErrorFormatter.formatWrongSymbol(";"));
        assertEquals("unknown symbol", SyntaxErrorFormatter.formatWrongSymbol(null));
        assertEquals("a'b", SyntaxErrorFormatter.extractOffendingTextFromLexerMessage("token recognition error at: 'a\\'b'"));
        assertNull(SyntaxErrorFormatter.extractOffendingTextFromLexerMessage("something else"));
        assertEquals("A", SyntaxErrorFormatter.resolveOffendingText(65));
    }
}
