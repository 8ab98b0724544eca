package com.gmlparser.ast;

/**
 * A start/end pair, as computed once by the AST builder and handed to node constructors.
 */
public record Span(Location start, Location end) {
}
