package com.gmlparser.ast;

public record Property(
    Location start,
    Location end,
    String name,
    Expression value
) implements Node {
    public Property(Span span, String name, Expression value) {
        this(span.start(), span.end(), name, value);
    }

    @Override
    public String type() {
        return "Property";
    }
}
