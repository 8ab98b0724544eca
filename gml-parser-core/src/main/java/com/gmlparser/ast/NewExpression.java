package com.gmlparser.ast;

import java.util.List;

public record NewExpression(
    Location start,
    Location end,
    Identifier expression,  // Can be null
    List<Expression> arguments
) implements Expression {
    public NewExpression(Span span, Identifier expression, List<Expression> arguments) {
        this(span.start(), span.end(), expression, arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }
}
