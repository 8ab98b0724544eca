package com.gmlparser.ast;

public record ContinueStatement(
    Location start,
    Location end
) implements Statement {
    public ContinueStatement(Span span) {
        this(span.start(), span.end());
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }
}
