package com.gmlparser.ast;

import java.util.List;

public record EnumDeclaration(
    Location start,
    Location end,
    Identifier name,
    List<EnumMember> members,
    boolean hasTrailingComma
) implements Statement {
    public EnumDeclaration(Span span, Identifier name, List<EnumMember> members, boolean hasTrailingComma) {
        this(span.start(), span.end(), name, members, hasTrailingComma);
    }

    @Override
    public String type() {
        return "EnumDeclaration";
    }
}
