package com.gmlparser.ast;

public record Finalizer(
    Location start,
    Location end,
    Statement body
) implements Node {
    public Finalizer(Span span, Statement body) {
        this(span.start(), span.end(), body);
    }

    @Override
    public String type() {
        return "Finalizer";
    }
}
