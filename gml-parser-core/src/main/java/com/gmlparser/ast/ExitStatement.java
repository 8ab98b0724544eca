package com.gmlparser.ast;

public record ExitStatement(
    Location start,
    Location end
) implements Statement {
    public ExitStatement(Span span) {
        this(span.start(), span.end());
    }

    @Override
    public String type() {
        return "ExitStatement";
    }
}
