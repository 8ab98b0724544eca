package com.gmlparser.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Precedence and associativity of every GML operator. Higher precedence binds tighter.
 * The parser climbs precedence with it and the AST builder uses it to decide where
 * synthetic parentheses are needed.
 */
public final class OperatorTable {

    public enum Associativity { LEFT, RIGHT }

    public enum OperatorClass { UNARY, ARITHMETIC, BITWISE, COMPARISON, LOGICAL, ASSIGN }

    public record Operator(String symbol, int precedence, Associativity associativity, OperatorClass operatorClass) {

        /**
         * True for operators that may appear between two operands of a binary expression.
         */
        public boolean isBinary() {
            return operatorClass != OperatorClass.UNARY && operatorClass != OperatorClass.ASSIGN;
        }

        public boolean isRightAssociative() {
            return associativity == Associativity.RIGHT;
        }
    }

    private static final Map<String, Operator> OPERATORS;

    static {
        Map<String, Operator> table = new LinkedHashMap<>();
        put(table, 15, Associativity.RIGHT, OperatorClass.UNARY, "++", "--");
        put(table, 14, Associativity.RIGHT, OperatorClass.UNARY, "~", "!");
        put(table, 13, Associativity.LEFT, OperatorClass.ARITHMETIC, "*", "/", "div", "%", "mod");
        put(table, 12, Associativity.LEFT, OperatorClass.ARITHMETIC, "+", "-");
        put(table, 12, Associativity.LEFT, OperatorClass.BITWISE, "<<", ">>");
        put(table, 11, Associativity.LEFT, OperatorClass.BITWISE, "&");
        put(table, 10, Associativity.LEFT, OperatorClass.BITWISE, "^");
        put(table, 9, Associativity.LEFT, OperatorClass.BITWISE, "|");
        put(table, 8, Associativity.LEFT, OperatorClass.COMPARISON, "<", "<=", ">", ">=");
        put(table, 7, Associativity.LEFT, OperatorClass.COMPARISON, "==", "!=", "<>");
        put(table, 6, Associativity.LEFT, OperatorClass.LOGICAL, "&&", "and");
        put(table, 5, Associativity.LEFT, OperatorClass.LOGICAL, "||", "or");
        put(table, 4, Associativity.RIGHT, OperatorClass.LOGICAL, "??");
        put(table, 1, Associativity.RIGHT, OperatorClass.ASSIGN,
            "*=", ":=", "=", "/=", "%=", "+=", "-=", "<<=", ">>=", "&=", "^=", "|=", "??=");
        OPERATORS = Collections.unmodifiableMap(table);
    }

    private OperatorTable() {
    }

    private static void put(Map<String, Operator> table, int precedence, Associativity associativity,
                            OperatorClass operatorClass, String... symbols) {
        for (String symbol : symbols) {
            table.put(symbol, new Operator(symbol, precedence, associativity, operatorClass));
        }
    }

    /**
     * @return the operator, or {@code null} when {@code symbol} is not an operator
     */
    public static Operator lookup(String symbol) {
        return OPERATORS.get(symbol);
    }

    /**
     * Precedence of {@code symbol}, or 0 for anything that is not an operator.
     */
    public static int precedenceOf(String symbol) {
        Operator operator = OPERATORS.get(symbol);
        return operator != null ? operator.precedence() : 0;
    }

    public static Map<String, Operator> all() {
        return OPERATORS;
    }
}
