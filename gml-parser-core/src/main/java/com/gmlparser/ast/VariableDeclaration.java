package com.gmlparser.ast;

import java.util.List;

public record VariableDeclaration(
    Location start,
    Location end,
    List<VariableDeclarator> declarations,
    String kind  // "var" or "static"
) implements Statement {
    public VariableDeclaration(Span span, List<VariableDeclarator> declarations, String kind) {
        this(span.start(), span.end(), declarations, kind);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
