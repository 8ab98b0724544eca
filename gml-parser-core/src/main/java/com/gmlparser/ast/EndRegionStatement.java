package com.gmlparser.ast;

public record EndRegionStatement(
    Location start,
    Location end,
    String name  // Can be null
) implements Statement {
    public EndRegionStatement(Span span, String name) {
        this(span.start(), span.end(), name);
    }

    @Override
    public String type() {
        return "EndRegionStatement";
    }
}
