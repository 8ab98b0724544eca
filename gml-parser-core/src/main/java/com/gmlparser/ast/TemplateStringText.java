package com.gmlparser.ast;

public record TemplateStringText(
    Location start,
    Location end,
    String value
) implements Node {
    public TemplateStringText(Span span, String value) {
        this(span.start(), span.end(), value);
    }

    @Override
    public String type() {
        return "TemplateStringText";
    }
}
