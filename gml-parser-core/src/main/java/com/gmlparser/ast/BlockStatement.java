package com.gmlparser.ast;

import java.util.List;

public record BlockStatement(
    Location start,
    Location end,
    List<Statement> body
) implements Statement {
    public BlockStatement(Span span, List<Statement> body) {
        this(span.start(), span.end(), body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}
