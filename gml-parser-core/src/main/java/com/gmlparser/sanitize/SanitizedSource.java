package com.gmlparser.sanitize;

import java.util.List;

/**
 * Result of {@link ConditionalAssignmentSanitizer#sanitize(String)}.
 *
 * @param text             the text to hand to the lexer
 * @param indexAdjustments offsets in {@code text} where a character was inserted, or
 *                         {@code null} when {@code text} is the unmodified input
 */
public record SanitizedSource(String text, List<Integer> indexAdjustments) {

    public SanitizedSource {
        indexAdjustments = indexAdjustments == null ? null : List.copyOf(indexAdjustments);
    }

    public static SanitizedSource unchanged(String text) {
        return new SanitizedSource(text, null);
    }

    public boolean isModified() {
        return indexAdjustments != null;
    }

    public IndexMapper indexMapper() {
        return IndexMapper.of(indexAdjustments);
    }
}
