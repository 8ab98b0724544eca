package com.gmlparser.ast;

/**
 * {@code // text}
 */
public final class CommentLine extends Comment {

    public CommentLine(Location start, Location end, String value) {
        super(start, end, value);
    }

    public CommentLine(Span span, String value) {
        this(span.start(), span.end(), value);
    }

    @Override
    public String type() {
        return "CommentLine";
    }
}
