package com.gmlparser.ast;

import java.util.List;

public record MacroDeclaration(
    Location start,
    Location end,
    Identifier name,
    List<String> tokens
) implements Statement {
    public MacroDeclaration(Span span, Identifier name, List<String> tokens) {
        this(span.start(), span.end(), name, tokens);
    }

    @Override
    public String type() {
        return "MacroDeclaration";
    }
}
