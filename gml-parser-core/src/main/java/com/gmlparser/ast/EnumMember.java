package com.gmlparser.ast;

/**
 * One enum entry. A literal initializer is kept as-is; any other initializer also records
 * its trimmed source text.
 */
public record EnumMember(
    Location start,
    Location end,
    Identifier name,
    Expression initializer,  // Can be null
    String initializerText  // Can be null
) implements Node {
    public EnumMember(Span span, Identifier name, Expression initializer, String initializerText) {
        this(span.start(), span.end(), name, initializer, initializerText);
    }

    @Override
    public String type() {
        return "EnumMember";
    }
}
