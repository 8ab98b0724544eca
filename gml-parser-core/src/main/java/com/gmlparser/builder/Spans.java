package com.gmlparser.builder;

import com.gmlparser.ast.Location;
import com.gmlparser.ast.Span;
import com.gmlparser.grammar.LineBreaks;
import com.gmlparser.grammar.ParseNode;
import com.gmlparser.grammar.Token;

/**
 * Source locations for AST nodes. Every call returns fresh {@link Location} instances so no
 * two nodes ever share one.
 */
final class Spans {

    private Spans() {
    }

    /**
     * Start of the rule's first token to the end of its last one. The end line counts the
     * line breaks inside the stop token, so multi-line strings end on the right line. A rule
     * that matched nothing, or only EOF, ends where it starts.
     */
    static Span of(ParseNode ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        Location startLocation = new Location(start.line(), start.startIndex());
        if (stop == null || stop.stopIndex() < start.startIndex()) {
            return new Span(startLocation, startLocation.copy());
        }
        return new Span(
            startLocation,
            new Location(stop.line() + LineBreaks.count(stop.text()), stop.stopIndex())
        );
    }

    static Span of(Token token) {
        return new Span(
            new Location(token.line(), token.startIndex()),
            new Location(token.line() + LineBreaks.count(token.text()), token.stopIndex())
        );
    }

    /**
     * From {@code from}'s start to {@code to}'s end, both copied.
     */
    static Span between(Location from, Location to) {
        return new Span(from.copy(), to.copy());
    }

    static Span copyOf(Span span) {
        return between(span.start(), span.end());
    }

    /**
     * Location of a function name. The end index is exclusive here, unlike node ends.
     */
    static Span identifierLocation(Token token) {
        return new Span(
            new Location(token.line(), token.startIndex()),
            new Location(token.line(), token.stopIndex() + 1)
        );
    }
}
