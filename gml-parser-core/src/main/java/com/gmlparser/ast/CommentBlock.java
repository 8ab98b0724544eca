package com.gmlparser.ast;

/**
 * A block comment. {@code lineCount} is the number of source lines it spans.
 */
public final class CommentBlock extends Comment {
    private final int lineCount;

    public CommentBlock(Location start, Location end, String value, int lineCount) {
        super(start, end, value);
        this.lineCount = lineCount;
    }

    public CommentBlock(Span span, String value, int lineCount) {
        this(span.start(), span.end(), value, lineCount);
    }

    public int lineCount() {
        return lineCount;
    }

    @Override
    public String type() {
        return "CommentBlock";
    }
}
