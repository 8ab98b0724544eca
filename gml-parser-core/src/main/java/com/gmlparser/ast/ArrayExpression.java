package com.gmlparser.ast;

import java.util.List;

public record ArrayExpression(
    Location start,
    Location end,
    List<Expression> elements,
    boolean hasTrailingComma
) implements Expression {
    public ArrayExpression(Span span, List<Expression> elements, boolean hasTrailingComma) {
        this(span.start(), span.end(), elements, hasTrailingComma);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
