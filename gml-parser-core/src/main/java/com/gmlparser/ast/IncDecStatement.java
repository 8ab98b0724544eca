package com.gmlparser.ast;

public record IncDecStatement(
    Location start,
    Location end,
    String operator,
    boolean prefix,
    Expression argument
) implements Statement {
    public IncDecStatement(Span span, String operator, boolean prefix, Expression argument) {
        this(span.start(), span.end(), operator, prefix, argument);
    }

    public IncDecExpression toExpression() {
        return new IncDecExpression(start, end, operator, prefix, argument);
    }

    @Override
    public String type() {
        return "IncDecStatement";
    }
}
