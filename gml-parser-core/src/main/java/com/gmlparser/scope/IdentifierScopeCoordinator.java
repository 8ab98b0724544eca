package com.gmlparser.scope;

import com.gmlparser.ast.Identifier;

import java.util.function.Supplier;

/**
 * What the AST builder sees of identifier metadata: scopes, roles and the classification
 * of each identifier against the innermost role.
 */
public class IdentifierScopeCoordinator {
    private final ScopeTracker scopeTracker;
    private final IdentifierRoleTracker roleTracker;

    public IdentifierScopeCoordinator(ScopeTracker scopeTracker, IdentifierRoleTracker roleTracker) {
        this.scopeTracker = scopeTracker != null ? scopeTracker : ScopeTracker.disabled();
        this.roleTracker = roleTracker;
    }

    public boolean isEnabled() {
        return scopeTracker.isEnabled();
    }

    public <T> T withScope(ScopeKind kind, Supplier<T> body) {
        return scopeTracker.withScope(kind, body);
    }

    public <T> T withRole(IdentifierRole role, Supplier<T> body) {
        if (!isEnabled() || role == null) {
            return body.get();
        }
        return roleTracker.withRole(role, body);
    }

    /**
     * Declares or references {@code node} depending on whether the innermost role is a
     * declaration. Does nothing while tracking is off.
     */
    public void applyCurrentRole(Identifier node) {
        if (!isEnabled() || node == null || node.name() == null || node.name().isEmpty()) {
            return;
        }
        IdentifierRole role = roleTracker.cloneRole(roleTracker.currentRole());
        if (role instanceof IdentifierRole.Declaration declaration) {
            scopeTracker.declare(node.name(), node, declaration);
        } else {
            scopeTracker.reference(node.name(), node, (IdentifierRole.Reference) role);
        }
    }
}
