package com.gmlparser.ast;

import java.util.List;

public record CallExpression(
    Location start,
    Location end,
    Expression object,
    List<Expression> arguments
) implements Statement, Expression {
    public CallExpression(Span span, Expression object, List<Expression> arguments) {
        this(span.start(), span.end(), object, arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
