package com.gmlparser.ast;

public record CatchClause(
    Location start,
    Location end,
    Identifier param,  // Can be null
    Statement body
) implements Node {
    public CatchClause(Span span, Identifier param, Statement body) {
        this(span.start(), span.end(), param, body);
    }

    @Override
    public String type() {
        return "CatchClause";
    }
}
