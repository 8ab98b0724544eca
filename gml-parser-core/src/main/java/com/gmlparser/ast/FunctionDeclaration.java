package com.gmlparser.ast;

import java.util.List;

public record FunctionDeclaration(
    Location start,
    Location end,
    String id,  // null for anonymous functions
    Span idLocation,  // Can be null
    List<Expression> params,  // Identifier or DefaultParameter
    BlockStatement body,
    boolean hasTrailingComma
) implements Statement, Expression {
    public FunctionDeclaration(Span span, String id, Span idLocation, List<Expression> params, BlockStatement body, boolean hasTrailingComma) {
        this(span.start(), span.end(), id, idLocation, params, body, hasTrailingComma);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
