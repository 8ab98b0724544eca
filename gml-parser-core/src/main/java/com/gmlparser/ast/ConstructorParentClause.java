package com.gmlparser.ast;

import java.util.List;

public record ConstructorParentClause(
    Location start,
    Location end,
    String id,
    List<Expression> params,
    boolean hasTrailingComma
) implements Node {
    public ConstructorParentClause(Span span, String id, List<Expression> params, boolean hasTrailingComma) {
        this(span.start(), span.end(), id, params, hasTrailingComma);
    }

    @Override
    public String type() {
        return "ConstructorParentClause";
    }
}
