package com.gmlparser.scope;

import java.util.List;

/**
 * Everything recorded for one scope, as returned by {@link ScopeTracker#exportOccurrences(boolean)}.
 */
public record ScopeOccurrences(String scopeId, ScopeKind scopeKind, List<IdentifierOccurrences> identifiers) {

    public record IdentifierOccurrences(String name, List<Occurrence> declarations, List<Occurrence> references) {
    }
}
