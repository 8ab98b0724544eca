package com.gmlparser.ast;

public record TryStatement(
    Location start,
    Location end,
    Statement block,
    CatchClause handler,  // Can be null
    Finalizer finalizer  // Can be null
) implements Statement {
    public TryStatement(Span span, Statement block, CatchClause handler, Finalizer finalizer) {
        this(span.start(), span.end(), block, handler, finalizer);
    }

    @Override
    public String type() {
        return "TryStatement";
    }
}
