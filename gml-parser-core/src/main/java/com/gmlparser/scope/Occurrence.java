package com.gmlparser.scope;

import com.gmlparser.ast.DeclarationRef;
import com.gmlparser.ast.Location;

import java.util.List;

/**
 * One recorded declaration or reference of a name.
 */
public record Occurrence(
    Kind kind,
    String name,
    String scopeId,
    List<String> classifications,
    DeclarationRef declaration,  // Can be null
    Location start,
    Location end
) {
    public enum Kind { DECLARATION, REFERENCE }

    Occurrence copy() {
        DeclarationRef declarationCopy = declaration == null ? null
            : new DeclarationRef(declaration.scopeId(), copyOf(declaration.start()), copyOf(declaration.end()));
        return new Occurrence(kind, name, scopeId, classifications, declarationCopy, copyOf(start), copyOf(end));
    }

    private static Location copyOf(Location location) {
        return location == null ? null : location.copy();
    }
}
