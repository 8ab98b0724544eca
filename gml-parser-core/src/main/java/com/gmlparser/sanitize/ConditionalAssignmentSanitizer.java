package com.gmlparser.sanitize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites bare {@code =} inside {@code if (...)} conditions to {@code ==}. GML treats
 * {@code if (a = b)} as a comparison but the grammar rejects an assignment there.
 *
 * <p>Comments and string literals are copied through untouched, inside the condition and
 * out. An {@code =} that is part of {@code ==} or follows one of
 * {@code * + - / % | & ^ < > ! = :} is left alone.</p>
 */
public final class ConditionalAssignmentSanitizer {
    private static final Logger log = LoggerFactory.getLogger(ConditionalAssignmentSanitizer.class);

    private static final Set<Character> ASSIGNMENT_GUARD_CHARACTERS =
        Set.of('*', '+', '-', '/', '%', '|', '&', '^', '<', '>', '!', '=', ':');

    private ConditionalAssignmentSanitizer() {
    }

    public static SanitizedSource sanitize(String source) {
        if (source == null || source.isEmpty()) {
            return SanitizedSource.unchanged(source);
        }

        StringBuilder out = new StringBuilder(source.length() + 16);
        List<Integer> adjustments = new ArrayList<>();
        int length = source.length();
        int index = 0;
        boolean inLineComment = false;
        boolean inBlockComment = false;
        char stringQuote = 0;
        boolean escapeNext = false;
        boolean justSawIf = false;
        int conditionDepth = 0;

        while (index < length) {
            char c = source.charAt(index);
            char next = index + 1 < length ? source.charAt(index + 1) : 0;

            if (inLineComment) {
                out.append(c);
                if (c == '\n' || c == '\r') {
                    inLineComment = false;
                }
                index++;
                continue;
            }

            if (inBlockComment) {
                out.append(c);
                if (c == '*' && next == '/') {
                    out.append(next);
                    index += 2;
                    inBlockComment = false;
                    continue;
                }
                index++;
                continue;
            }

            if (stringQuote != 0) {
                out.append(c);
                if (escapeNext) {
                    escapeNext = false;
                } else if (c == '\\') {
                    escapeNext = true;
                } else if (c == stringQuote) {
                    stringQuote = 0;
                }
                index++;
                continue;
            }

            if (c == '/' && next == '/') {
                out.append(c).append(next);
                index += 2;
                inLineComment = true;
                continue;
            }

            if (c == '/' && next == '*') {
                out.append(c).append(next);
                index += 2;
                inBlockComment = true;
                continue;
            }

            if (isQuote(c)) {
                stringQuote = c;
                out.append(c);
                index++;
                continue;
            }

            if ((c == 'i' || c == 'I') && (next == 'f' || next == 'F')) {
                char before = index > 0 ? source.charAt(index - 1) : 0;
                char after = index + 2 < length ? source.charAt(index + 2) : 0;
                if (!isWordChar(before) && !isWordChar(after)) {
                    out.append(c).append(next);
                    index += 2;
                    justSawIf = true;
                    continue;
                }
            }

            if (justSawIf) {
                if (Character.isWhitespace(c)) {
                    out.append(c);
                    index++;
                    continue;
                }
                justSawIf = false;
                if (c == '(') {
                    out.append(c);
                    index++;
                    conditionDepth = 1;
                    continue;
                }
            }

            if (conditionDepth > 0) {
                if (c == '(') {
                    conditionDepth++;
                } else if (c == ')') {
                    conditionDepth--;
                } else if (c == '=') {
                    char before = index > 0 ? source.charAt(index - 1) : 0;
                    if (next != '=' && !ASSIGNMENT_GUARD_CHARACTERS.contains(before)) {
                        out.append("==");
                        adjustments.add(out.length() - 1);
                        index++;
                        continue;
                    }
                }
            }

            out.append(c);
            index++;
        }

        if (adjustments.isEmpty()) {
            return SanitizedSource.unchanged(source);
        }
        log.debug("Expanded {} conditional assignment(s) to equality checks", adjustments.size());
        return new SanitizedSource(out.toString(), adjustments);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }

    private static boolean isWordChar(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
