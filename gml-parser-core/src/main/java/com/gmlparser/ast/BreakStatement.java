package com.gmlparser.ast;

public record BreakStatement(
    Location start,
    Location end
) implements Statement {
    public BreakStatement(Span span) {
        this(span.start(), span.end());
    }

    @Override
    public String type() {
        return "BreakStatement";
    }
}
