package com.gmlparser.ast;

/**
 * Legacy {@code #define} line, recorded with the directive it stands in for.
 */
public record DefineStatement(
    Location start,
    Location end,
    String name,
    String replacementDirective,  // "#region", "#endregion" or "#macro"
    String replacementSuffix
) implements Statement {
    public DefineStatement(Span span, String name, String replacementDirective, String replacementSuffix) {
        this(span.start(), span.end(), name, replacementDirective, replacementSuffix);
    }

    @Override
    public String type() {
        return "DefineStatement";
    }
}
