package com.gmlparser.grammar;

/**
 * A node of the grammar-shaped tree: either a rule context or a matched token.
 */
public sealed interface ParseTree permits ParseNode, TerminalNode {

    Token getStart();

    Token getStop();

    String getText();
}
