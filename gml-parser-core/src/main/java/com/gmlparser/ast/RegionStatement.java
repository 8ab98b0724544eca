package com.gmlparser.ast;

public record RegionStatement(
    Location start,
    Location end,
    String name  // Can be null
) implements Statement {
    public RegionStatement(Span span, String name) {
        this(span.start(), span.end(), name);
    }

    @Override
    public String type() {
        return "RegionStatement";
    }
}
