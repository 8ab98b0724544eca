package com.gmlparser.ast;

import java.util.List;

public record GlobalVarStatement(
    Location start,
    Location end,
    List<VariableDeclarator> declarations,
    String kind  // always "globalvar"
) implements Statement {
    public GlobalVarStatement(Span span, List<VariableDeclarator> declarations, String kind) {
        this(span.start(), span.end(), declarations, kind);
    }

    @Override
    public String type() {
        return "GlobalVarStatement";
    }
}
