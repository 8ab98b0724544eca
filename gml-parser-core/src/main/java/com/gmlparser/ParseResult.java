package com.gmlparser;

import com.gmlparser.ast.Comment;
import com.gmlparser.ast.Program;
import com.gmlparser.ast.Whitespace;
import com.gmlparser.diagnostics.GmlSyntaxError;
import com.gmlparser.scope.ScopeOccurrences;

import java.util.List;

/**
 * Outcome of {@link GmlParser#tryParse}: the tree with its side lists, or the syntax error.
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    boolean isSuccess();

    /**
     * @param comments    every comment in source order, whether or not attached to the program
     * @param whitespaces every whitespace run in source order
     * @param scopes      identifier occurrences per scope; empty unless scope tracking was on
     */
    record Success(
        Program program,
        List<Comment> comments,
        List<Whitespace> whitespaces,
        List<ScopeOccurrences> scopes
    ) implements ParseResult {
        public Success {
            comments = List.copyOf(comments);
            whitespaces = List.copyOf(whitespaces);
            scopes = List.copyOf(scopes);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(GmlSyntaxError error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
