package com.gmlparser.ast;

import java.util.List;

public record SwitchStatement(
    Location start,
    Location end,
    Expression discriminant,
    List<SwitchCase> cases
) implements Statement {
    public SwitchStatement(Span span, Expression discriminant, List<SwitchCase> cases) {
        this(span.start(), span.end(), discriminant, cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }
}
