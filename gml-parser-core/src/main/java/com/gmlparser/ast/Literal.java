package com.gmlparser.ast;

public record Literal(
    Location start,
    Location end,
    String value  // source text, quotes included
) implements Expression {
    public Literal(Span span, String value) {
        this(span.start(), span.end(), value);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
