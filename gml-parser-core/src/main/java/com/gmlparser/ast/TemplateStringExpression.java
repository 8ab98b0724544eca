package com.gmlparser.ast;

import java.util.List;

public record TemplateStringExpression(
    Location start,
    Location end,
    List<Node> atoms  // TemplateStringText or Expression
) implements Expression {
    public TemplateStringExpression(Span span, List<Node> atoms) {
        this(span.start(), span.end(), atoms);
    }

    @Override
    public String type() {
        return "TemplateStringExpression";
    }
}
