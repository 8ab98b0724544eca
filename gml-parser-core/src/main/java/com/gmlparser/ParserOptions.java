package com.gmlparser;

import com.gmlparser.grammar.GameMakerLanguageParser;

/**
 * Switches for one parse.
 *
 * @param getComments                    attach the comment list to {@code Program.comments}
 * @param sanitizeConditionalAssignments rewrite {@code if (a = b)} to {@code if (a == b)} before parsing
 * @param scopeTracking                  annotate identifiers with scopes and declarations
 * @param maxNestingDepth                deepest bracket nesting (braces, parentheses, brackets) accepted
 *                                       before a syntax error
 */
public record ParserOptions(
    boolean getComments,
    boolean sanitizeConditionalAssignments,
    boolean scopeTracking,
    int maxNestingDepth
) {
    public ParserOptions {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(true, true, false, GameMakerLanguageParser.DEFAULT_MAX_NESTING_DEPTH);
    }

    public ParserOptions withComments(boolean getComments) {
        return new ParserOptions(getComments, sanitizeConditionalAssignments, scopeTracking, maxNestingDepth);
    }

    public ParserOptions withSanitizeConditionalAssignments(boolean sanitize) {
        return new ParserOptions(getComments, sanitize, scopeTracking, maxNestingDepth);
    }

    public ParserOptions withScopeTracking(boolean scopeTracking) {
        return new ParserOptions(getComments, sanitizeConditionalAssignments, scopeTracking, maxNestingDepth);
    }

    public ParserOptions withMaxNestingDepth(int maxNestingDepth) {
        return new ParserOptions(getComments, sanitizeConditionalAssignments, scopeTracking, maxNestingDepth);
    }
}
