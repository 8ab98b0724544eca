package com.gmlparser.ast;

/**
 * Where a resolved identifier was declared. Locations are copies, never the declaring
 * identifier's own instances.
 */
public record DeclarationRef(String scopeId, Location start, Location end) {
}
