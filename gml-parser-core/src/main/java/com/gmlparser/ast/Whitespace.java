package com.gmlparser.ast;

/**
 * A whitespace run or line break from the hidden channel.
 */
public record Whitespace(
    Location start,
    Location end,
    String value,
    boolean isNewline
) implements Node {
    public Whitespace(Span span, String value, boolean isNewline) {
        this(span.start(), span.end(), value, isNewline);
    }

    @Override
    public String type() {
        return "Whitespace";
    }
}
