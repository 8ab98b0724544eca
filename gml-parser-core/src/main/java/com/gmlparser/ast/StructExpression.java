package com.gmlparser.ast;

import java.util.List;

public record StructExpression(
    Location start,
    Location end,
    List<Property> properties,
    boolean hasTrailingComma
) implements Expression {
    public StructExpression(Span span, List<Property> properties, boolean hasTrailingComma) {
        this(span.start(), span.end(), properties, hasTrailingComma);
    }

    @Override
    public String type() {
        return "StructExpression";
    }
}
