package com.gmlparser.hidden;

import com.gmlparser.ast.Comment;
import com.gmlparser.ast.CommentBlock;
import com.gmlparser.ast.CommentLine;
import com.gmlparser.ast.Location;
import com.gmlparser.ast.Whitespace;
import com.gmlparser.grammar.LineBreaks;
import com.gmlparser.grammar.Token;
import com.gmlparser.grammar.TokenType;

import java.util.List;

/**
 * Turns the hidden channel into comment and whitespace nodes, annotating each comment
 * with what surrounds it: the whitespace before and after, the last significant character
 * before it and the first one after it, and whether it is the first or last comment of the file.
 *
 * <p>Tokens must be fed strictly in stream order. One instance serves one parse.</p>
 */
public class HiddenTokenProcessor {
    private final List<Comment> comments;
    private final List<Whitespace> whitespaces;

    private boolean reachedEOF = false;
    private Comment prevComment;
    private Comment finalComment;
    private final StringBuilder prevWS = new StringBuilder();
    private String prevSignificantChar = "";
    private boolean foundFirstSignificantToken = false;

    /**
     * @param comments    receives comment nodes in source order
     * @param whitespaces receives whitespace nodes in source order
     */
    public HiddenTokenProcessor(List<Comment> comments, List<Whitespace> whitespaces) {
        this.comments = comments;
        this.whitespaces = whitespaces;
    }

    public void processAll(List<Token> tokens) {
        for (Token token : tokens) {
            if (reachedEOF) {
                break;
            }
            process(token);
        }
    }

    public void process(Token token) {
        if (reachedEOF) {
            return;
        }
        TokenType type = token.type();
        if (type == TokenType.EOF) {
            reachedEOF = true;
            if (finalComment != null) {
                finalComment.setBottomComment(true);
            }
        } else if (type.isComment()) {
            comment(token);
        } else if (type.isWhitespace()) {
            whitespace(token);
        } else {
            significant(token);
        }
    }

    public boolean hasReachedEnd() {
        return reachedEOF;
    }

    private void comment(Token token) {
        String text = token.text();
        int lineBreaks = LineBreaks.count(text);
        Location start = new Location(token.line(), token.startIndex());
        Location end = new Location(token.line() + lineBreaks, token.stopIndex());
        Comment node;
        if (token.type() == TokenType.SINGLE_LINE_COMMENT) {
            node = new CommentLine(start, end, text.startsWith("//") ? text.substring(2) : text);
        } else {
            String value = text.startsWith("/*") ? text.substring(2) : text;
            if (value.endsWith("*/")) {
                value = value.substring(0, value.length() - 2);
            }
            node = new CommentBlock(start, end, value, lineBreaks + 1);
        }
        node.setLeadingWS(prevWS.toString());
        node.setLeadingChar(prevSignificantChar);

        prevComment = node;
        finalComment = node;
        prevWS.setLength(0);
        comments.add(node);

        if (!foundFirstSignificantToken) {
            node.setTopComment(true);
            foundFirstSignificantToken = true;
        }
    }

    private void whitespace(Token token) {
        String text = token.text();
        int lineBreaks = LineBreaks.count(text);
        whitespaces.add(new Whitespace(
            new Location(token.line(), token.startIndex()),
            new Location(token.line() + lineBreaks, token.stopIndex()),
            text,
            token.type() == TokenType.LINE_TERMINATOR));
        if (prevComment != null) {
            prevComment.setTrailingWS(prevComment.trailingWS() + text);
        }
        prevComment = null;
        prevWS.append(text);
    }

    private void significant(Token token) {
        String text = token.text();
        foundFirstSignificantToken = true;
        if (prevComment != null && !text.isEmpty()) {
            prevComment.setTrailingChar(text.substring(0, 1));
        }
        prevComment = null;
        prevWS.setLength(0);
        if (!text.isEmpty()) {
            prevSignificantChar = text.substring(text.length() - 1);
        }
    }
}
