package com.gmlparser.hidden;

import com.gmlparser.ast.Comment;
import com.gmlparser.ast.CommentBlock;
import com.gmlparser.ast.CommentLine;
import com.gmlparser.ast.Location;
import com.gmlparser.ast.Whitespace;
import com.gmlparser.grammar.GameMakerLanguageLexer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HiddenTokenProcessorTest {

    private final List<Comment> comments = new ArrayList<>();
    private final List<Whitespace> whitespaces = new ArrayList<>();

    private void process(String source) {
        HiddenTokenProcessor processor = new HiddenTokenProcessor(comments, whitespaces);
        processor.processAll(new GameMakerLanguageLexer(source).tokenize());
        assertTrue(processor.hasReachedEnd());
    }

    @Test
    void testCommentsAndWhitespaceAreCollectedInOrder() {
        process("// header\nx = 1; /* inline */\ny = 2; // tail");

        assertEquals(3, comments.size());
        assertEquals(8, whitespaces.size());
        assertInstanceOf(CommentLine.class, comments.get(0));
        assertInstanceOf(CommentBlock.class, comments.get(1));
        assertInstanceOf(CommentLine.class, comments.get(2));

        assertTrue(whitespaces.get(0).isNewline());
        assertEquals("\n", whitespaces.get(0).value());
        assertFalse(whitespaces.get(1).isNewline());
    }

    @Test
    void testLeadingComment() {
        process("// header\nx = 1; /* inline */\ny = 2; // tail");
        Comment header = comments.get(0);

        assertEquals(" header", header.value());
        assertEquals(new Location(1, 0), header.start());
        assertEquals(new Location(1, 8), header.end());
        assertTrue(header.isTopComment());
        assertFalse(header.isBottomComment());
        assertEquals("", header.leadingWS());
        assertEquals("", header.leadingChar());
        assertEquals("\n", header.trailingWS());
        assertEquals("", header.trailingChar(), "whitespace separates it from 'x'");
    }

    @Test
    void testInlineComment() {
        process("// header\nx = 1; /* inline */\ny = 2; // tail");
        CommentBlock inline = (CommentBlock) comments.get(1);

        assertEquals(" inline ", inline.value());
        assertEquals(1, inline.lineCount());
        assertEquals(new Location(2, 17), inline.start());
        assertEquals(new Location(2, 28), inline.end());
        assertFalse(inline.isTopComment());
        assertEquals(" ", inline.leadingWS());
        assertEquals(";", inline.leadingChar());
        assertEquals("\n", inline.trailingWS());
    }

    @Test
    void testTrailingCommentIsBottom() {
        process("// header\nx = 1; /* inline */\ny = 2; // tail");
        Comment tail = comments.get(2);

        assertEquals(" tail", tail.value());
        assertTrue(tail.isBottomComment());
        assertFalse(comments.get(1).isBottomComment());
        assertEquals(" ", tail.leadingWS());
        assertEquals(";", tail.leadingChar());
        assertEquals("", tail.trailingWS());
    }

    @Test
    void testTrailingCharNeedsAdjacentToken() {
        process("/*a*/x = 1;");
        Comment comment = comments.get(0);
        assertEquals("x", comment.trailingChar());
        assertEquals("", comment.trailingWS());
        assertTrue(comment.isTopComment());
    }

    @Test
    void testOnlyFirstCommentIsTop() {
        process("// one\n// two\nx = 1;");
        assertTrue(comments.get(0).isTopComment());
        assertFalse(comments.get(1).isTopComment());
        assertEquals("\n", comments.get(1).leadingWS());
    }

    @Test
    void testCommentAfterCodeIsNotTop() {
        process("x = 1; // note");
        assertFalse(comments.get(0).isTopComment());
        assertTrue(comments.get(0).isBottomComment());
    }

    @Test
    void testMultiLineBlockComment() {
        process("/* first\nsecond */\nx = 1;");
        CommentBlock block = (CommentBlock) comments.get(0);
        assertEquals(2, block.lineCount());
        assertEquals(" first\nsecond ", block.value());
        assertEquals(new Location(1, 0), block.start());
        assertEquals(new Location(2, 17), block.end());
    }

    @Test
    void testNoComments() {
        process("x = 1;");
        assertTrue(comments.isEmpty());
        assertEquals(2, whitespaces.size());
    }
}
