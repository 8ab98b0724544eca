package com.gmlparser.ast;

import java.util.List;

public record SwitchCase(
    Location start,
    Location end,
    Expression test,  // null for the default clause
    List<Statement> body  // Can be null
) implements Node {
    public SwitchCase(Span span, Expression test, List<Statement> body) {
        this(span.start(), span.end(), test, body);
    }

    @Override
    public String type() {
        return "SwitchCase";
    }
}
