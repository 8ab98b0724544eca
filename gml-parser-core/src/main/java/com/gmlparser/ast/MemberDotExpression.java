package com.gmlparser.ast;

public record MemberDotExpression(
    Location start,
    Location end,
    Expression object,
    Expression property
) implements Expression {
    public MemberDotExpression(Span span, Expression object, Expression property) {
        this(span.start(), span.end(), object, property);
    }

    @Override
    public String type() {
        return "MemberDotExpression";
    }
}
