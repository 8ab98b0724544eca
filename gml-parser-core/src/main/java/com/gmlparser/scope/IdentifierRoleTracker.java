package com.gmlparser.scope;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Stack of identifier roles mirroring the constructs being visited, e.g. a parameter role
 * active only while the parameter list is built.
 */
public class IdentifierRoleTracker {
    private final Deque<IdentifierRole> roles = new ArrayDeque<>();

    public <T> T withRole(IdentifierRole role, Supplier<T> body) {
        roles.push(cloneRole(role));
        try {
            return body.get();
        } finally {
            roles.pop();
        }
    }

    /**
     * @return the innermost role, or {@code null} outside any role
     */
    public IdentifierRole currentRole() {
        return roles.peek();
    }

    /**
     * A copy with its own tag list. A {@code null} role clones to a reference with no kind.
     */
    public IdentifierRole cloneRole(IdentifierRole role) {
        if (role instanceof IdentifierRole.Declaration d) {
            return new IdentifierRole.Declaration(d.kind(), d.tags(), d.scopeOverride());
        }
        if (role instanceof IdentifierRole.Reference r) {
            return new IdentifierRole.Reference(r.kind(), r.tags());
        }
        return new IdentifierRole.Reference(null, List.of());
    }
}
