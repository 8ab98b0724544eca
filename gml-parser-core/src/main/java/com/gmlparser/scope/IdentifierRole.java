package com.gmlparser.scope;

import java.util.List;

/**
 * What an identifier occurrence means at the point it is visited: a declaration of some
 * kind, or a reference to one.
 */
public sealed interface IdentifierRole permits IdentifierRole.Declaration, IdentifierRole.Reference {

    String GLOBAL_SCOPE = "global";

    RoleKind kind();

    List<String> tags();

    /**
     * @param scopeOverride {@code null} for the active scope, {@link #GLOBAL_SCOPE} for the
     *                      program scope, or the id of a scope on the stack
     */
    record Declaration(RoleKind kind, List<String> tags, String scopeOverride) implements IdentifierRole {
        public Declaration {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    record Reference(RoleKind kind, List<String> tags) implements IdentifierRole {
        public Reference {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    static Declaration declaration(RoleKind kind) {
        return new Declaration(kind, List.of(), null);
    }

    /**
     * A declaration stored on the program scope and tagged {@code global}, as
     * {@code globalvar} and {@code #macro} declare.
     */
    static Declaration globalDeclaration(RoleKind kind) {
        return new Declaration(kind, List.of(GLOBAL_SCOPE), GLOBAL_SCOPE);
    }

    static Reference reference(RoleKind kind) {
        return new Reference(kind, List.of());
    }
}
