package com.gmlparser.diagnostics;

import com.gmlparser.grammar.GameMakerLanguageParser;
import com.gmlparser.grammar.ParseNode;
import com.gmlparser.grammar.ParseNodeKind;
import com.gmlparser.grammar.Recognizer;
import com.gmlparser.grammar.Token;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link GmlSyntaxError}s from raw recognizer failures.
 */
public final class SyntaxErrorFormatter {
    private static final Pattern LEXER_MESSAGE = Pattern.compile("token recognition error at:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEXER_ESCAPE = Pattern.compile("\\\\([\\\\'])");
    private static final Pattern RULE_WORD_BOUNDARY = Pattern.compile("([A-Z]*)([A-Z][a-z])");

    private SyntaxErrorFormatter() {
    }

    public static GmlSyntaxError parserError(Recognizer recognizer, Object offendingSymbol, int line, int column,
                                             String message) {
        String offendingText = resolveOffendingText(offendingSymbol);
        String wrongSymbol = formatWrongSymbol(offendingText);
        List<String> stack = recognizer.getRuleInvocationStack();
        String currentRule = stack.isEmpty() ? null : stack.get(0);

        String text;
        if (message != null && message.startsWith(GameMakerLanguageParser.NESTING_DEPTH_EXCEEDED)) {
            text = prefix(line, column) + message;
        } else {
            text = specificMessage(recognizer, stack, currentRule, line, column, wrongSymbol);
            if (text == null) {
                text = prefix(line, column) + "unexpected " + wrongSymbol
                    + " while matching rule " + formatRuleName(currentRule);
            }
        }
        return new GmlSyntaxError(text, line, column, wrongSymbol, offendingText, currentRule);
    }

    public static GmlSyntaxError lexerError(Object offendingSymbol, int line, int column, String message) {
        String offendingText = resolveOffendingText(offendingSymbol);
        if (offendingText == null) {
            offendingText = extractOffendingTextFromLexerMessage(message);
        }
        String wrongSymbol = formatWrongSymbol(offendingText);
        return new GmlSyntaxError(prefix(line, column) + "unexpected " + wrongSymbol,
            line, column, wrongSymbol, offendingText, null);
    }

    /**
     * Source nested deeper than the JVM stack allows. No token position is known at that point.
     */
    public static GmlSyntaxError nestingDepthError(StackOverflowError cause) {
        return new GmlSyntaxError("Syntax Error: " + GameMakerLanguageParser.NESTING_DEPTH_EXCEEDED,
            null, null, null, null, null, cause);
    }

    /**
     * Same error reported at {@code column} on its line, message prefix included.
     */
    public static GmlSyntaxError withColumn(GmlSyntaxError error, int column) {
        String message = error.getMessage();
        String oldPrefix = prefix(error.getLine(), error.getColumn());
        if (message != null && message.startsWith(oldPrefix)) {
            message = prefix(error.getLine(), column) + message.substring(oldPrefix.length());
        }
        return new GmlSyntaxError(message, error.getLine(), column, error.getWrongSymbol(),
            error.getOffendingText(), error.getRule(), error.getCause());
    }

    private static String specificMessage(Recognizer recognizer, List<String> stack, String currentRule,
                                          int line, int column, String wrongSymbol) {
        if (currentRule == null) {
            return null;
        }
        String parentRule = stack.size() > 1 ? stack.get(1) : null;
        switch (currentRule) {
            case "closeBlock": {
                if (!"block".equals(parentRule)) {
                    return null;
                }
                Token openBrace = openBlockStart(recognizer.getContext());
                if (openBrace == null) {
                    return null;
                }
                return prefix(openBrace.line(), openBrace.column()) + "missing associated closing brace for this block";
            }
            case "lValueExpression":
                if (!"incDecStatement".equals(parentRule)) {
                    return null;
                }
                return prefix(line, column) + "++, -- can only be used on a variable-addressing expression";
            case "expression":
                return prefix(line, column) + "unexpected " + wrongSymbol + " in expression";
            case "statement":
            case "program":
                return prefix(line, column) + "unexpected " + wrongSymbol;
            case "parameterList":
                return prefix(line, column) + "unexpected " + wrongSymbol + " in function parameters, expected an identifier";
            default:
                return null;
        }
    }

    private static Token openBlockStart(ParseNode context) {
        if (context == null || context.parent() == null) {
            return null;
        }
        ParseNode openBlock = context.parent().child(ParseNodeKind.OPEN_BLOCK);
        return openBlock != null ? openBlock.getStart() : null;
    }

    static String prefix(int line, int column) {
        return "Syntax Error (line " + line + ", column " + column + "): ";
    }

    /**
     * Token text, a string symbol, or a code point; {@code null} when none applies.
     */
    static String resolveOffendingText(Object offendingSymbol) {
        if (offendingSymbol == null) {
            return null;
        }
        if (offendingSymbol instanceof Token token) {
            return token.text() == null || token.text().isEmpty() ? null : token.text();
        }
        if (offendingSymbol instanceof CharSequence text) {
            return text.length() == 0 ? null : text.toString();
        }
        if (offendingSymbol instanceof Integer codePoint && Character.isValidCodePoint(codePoint)) {
            return new String(Character.toChars(codePoint));
        }
        return null;
    }

    static String extractOffendingTextFromLexerMessage(String message) {
        if (message == null || message.isEmpty()) {
            return null;
        }
        Matcher matcher = LEXER_MESSAGE.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        String raw = matcher.group(1).trim();
        if (raw.isEmpty()) {
            return null;
        }
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return LEXER_ESCAPE.matcher(raw.substring(1, raw.length() - 1)).replaceAll("$1");
        }
        return raw;
    }

    static String formatWrongSymbol(String offendingText) {
        if (Token.EOF_TEXT.equals(offendingText)) {
            return "end of file";
        }
        if (offendingText != null && !offendingText.isEmpty()) {
            return "symbol '" + offendingText + "'";
        }
        return "unknown symbol";
    }

    /**
     * {@code lValueExpression} becomes {@code l value expression}.
     */
    static String formatRuleName(String rule) {
        if (rule == null) {
            return "unknown";
        }
        return RULE_WORD_BOUNDARY.matcher(rule).replaceAll("$1 $2").toLowerCase();
    }
}
