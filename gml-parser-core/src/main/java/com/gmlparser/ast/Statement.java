package com.gmlparser.ast;

/**
 * Nodes allowed in a statement list. Calls, assignments and function declarations are
 * both statements and expressions.
 */
public non-sealed interface Statement extends Node {
}
