package com.gmlparser.ast;

import java.util.List;

public record ConstructorDeclaration(
    Location start,
    Location end,
    String id,  // Can be null
    Span idLocation,  // Can be null
    List<Expression> params,  // Identifier or DefaultParameter
    ConstructorParentClause parent,  // Can be null
    BlockStatement body,
    boolean hasTrailingComma
) implements Statement, Expression {
    public ConstructorDeclaration(Span span, String id, Span idLocation, List<Expression> params, ConstructorParentClause parent, BlockStatement body, boolean hasTrailingComma) {
        this(span.start(), span.end(), id, idLocation, params, parent, body, hasTrailingComma);
    }

    @Override
    public String type() {
        return "ConstructorDeclaration";
    }
}
