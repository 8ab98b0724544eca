package com.gmlparser.ast;

public record IdentifierStatement(
    Location start,
    Location end,
    Identifier name
) implements Statement {
    public IdentifierStatement(Span span, Identifier name) {
        this(span.start(), span.end(), name);
    }

    @Override
    public String type() {
        return "IdentifierStatement";
    }
}
