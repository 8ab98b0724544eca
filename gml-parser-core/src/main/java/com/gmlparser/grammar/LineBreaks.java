package com.gmlparser.grammar;

public final class LineBreaks {

    private LineBreaks() {
    }

    /**
     * Number of line breaks in {@code text}; {@code \r\n} counts once.
     */
    public static int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                continue;
            }
            if (GameMakerLanguageLexer.isLineTerminator(c)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Offset of the first character of 1-based {@code line}, counting line terminators the
     * way the lexer does; -1 when {@code text} has fewer lines.
     */
    public static int lineStart(String text, int line) {
        if (line == 1) {
            return 0;
        }
        int current = 1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                continue;
            }
            if (GameMakerLanguageLexer.isLineTerminator(c) && ++current == line) {
                return i + 1;
            }
        }
        return -1;
    }
}
