package com.gmlparser.ast;

public record ForStatement(
    Location start,
    Location end,
    Statement init,  // Can be null
    Expression test,  // Can be null
    Statement update,  // Can be null
    Statement body
) implements Statement {
    public ForStatement(Span span, Statement init, Expression test, Statement update, Statement body) {
        this(span.start(), span.end(), init, test, update, body);
    }

    @Override
    public String type() {
        return "ForStatement";
    }
}
