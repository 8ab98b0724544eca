package com.gmlparser.ast;

/**
 * {@code ++x}, {@code x--} and friends in value position.
 */
public record IncDecExpression(
    Location start,
    Location end,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {
    public IncDecExpression(Span span, String operator, boolean prefix, Expression argument) {
        this(span.start(), span.end(), operator, prefix, argument);
    }

    /**
     * The same update occupying a whole statement slot.
     */
    public IncDecStatement toStatement() {
        return new IncDecStatement(start, end, operator, prefix, argument);
    }

    @Override
    public String type() {
        return "IncDecExpression";
    }
}
