package com.gmlparser.ast;

import java.util.List;

public record MemberIndexExpression(
    Location start,
    Location end,
    Expression object,
    List<Expression> property,
    String accessor  // "[", "[|", "[?", "[#", "[@" or "[$"
) implements Expression {
    public MemberIndexExpression(Span span, Expression object, List<Expression> property, String accessor) {
        this(span.start(), span.end(), object, property, accessor);
    }

    @Override
    public String type() {
        return "MemberIndexExpression";
    }
}
