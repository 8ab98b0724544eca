package com.gmlparser.ast;

import java.util.List;

public record Program(
    Location start,
    Location end,
    List<Statement> body,
    List<Comment> comments  // Empty unless comments were requested
) implements Node {
    public Program(Span span, List<Statement> body, List<Comment> comments) {
        this(span.start(), span.end(), body, comments);
    }

    public Program withComments(List<Comment> comments) {
        return new Program(start, end, body, comments);
    }

    @Override
    public String type() {
        return "Program";
    }
}
