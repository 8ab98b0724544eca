package com.gmlparser.ast;

/**
 * Placeholder for an argument left empty, as in {@code foo(, 2)}.
 */
public record MissingOptionalArgument(
    Location start,
    Location end
) implements Expression {
    public MissingOptionalArgument(Span span) {
        this(span.start(), span.end());
    }

    @Override
    public String type() {
        return "MissingOptionalArgument";
    }
}
