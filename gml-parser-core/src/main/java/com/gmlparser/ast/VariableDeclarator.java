package com.gmlparser.ast;

public record VariableDeclarator(
    Location start,
    Location end,
    Identifier id,
    Expression init  // Can be null
) implements Node {
    public VariableDeclarator(Span span, Identifier id, Expression init) {
        this(span.start(), span.end(), id, init);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
