package com.gmlparser.scope;

import com.gmlparser.ast.DeclarationRef;
import com.gmlparser.ast.Identifier;
import com.gmlparser.ast.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Tracks lexical scopes while the AST builder walks the parse tree and annotates
 * identifiers with scope ids, classifications and resolved declarations.
 *
 * <p>A disabled tracker runs every scope body directly and records nothing, so the
 * builder can call it unconditionally.</p>
 *
 * <p>Not thread-safe: one instance belongs to one parse.</p>
 */
public class ScopeTracker {
    private static final Logger log = LoggerFactory.getLogger(ScopeTracker.class);

    private final boolean enabled;
    private final Deque<Scope> scopeStack = new ArrayDeque<>();
    private final Map<String, Scope> scopesById = new LinkedHashMap<>();
    private Scope rootScope;
    private int scopeCounter = 0;

    public ScopeTracker(boolean enabled) {
        this.enabled = enabled;
    }

    public static ScopeTracker disabled() {
        return new ScopeTracker(false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Runs {@code body} inside a new scope of {@code kind}. The scope is popped on every
     * exit path, exceptions included.
     */
    public <T> T withScope(ScopeKind kind, Supplier<T> body) {
        if (!enabled) {
            return body.get();
        }
        enterScope(kind);
        try {
            return body.get();
        } finally {
            exitScope();
        }
    }

    private void enterScope(ScopeKind kind) {
        Scope scope = new Scope("scope-" + scopeCounter++, kind);
        scopeStack.push(scope);
        scopesById.put(scope.id(), scope);
        if (rootScope == null) {
            rootScope = scope;
        }
        log.trace("Entered {} scope {}", kind.value(), scope.id());
    }

    private void exitScope() {
        scopeStack.pop();
    }

    /**
     * Id of the innermost active scope, or {@code null} when disabled or outside any scope.
     */
    public String currentScopeId() {
        Scope scope = enabled ? scopeStack.peek() : null;
        return scope != null ? scope.id() : null;
    }

    /**
     * Records {@code node} as the declaration of {@code name}, in the active scope or the
     * one named by the role's scope override.
     */
    public void declare(String name, Identifier node, IdentifierRole.Declaration role) {
        if (!enabled || name == null || name.isEmpty() || node == null) {
            return;
        }
        Scope scope = resolveScopeOverride(role.scopeOverride());
        String scopeId = scope != null ? scope.id() : null;
        List<String> classifications = buildClassifications(role.kind(), role.tags(), true);

        Occurrence declaration = new Occurrence(Occurrence.Kind.DECLARATION, name, scopeId, classifications,
            null, copyOf(node.start()), copyOf(node.end()));
        if (scope != null) {
            scope.storeDeclaration(name, declaration);
        }

        node.setScopeId(scopeId);
        node.setClassifications(classifications);
        node.setDeclaration(toRef(declaration));

        if (scope != null) {
            scope.record(new Occurrence(Occurrence.Kind.DECLARATION, name, scopeId, classifications,
                toRef(declaration), copyOf(node.start()), copyOf(node.end())));
        }
    }

    /**
     * Records {@code node} as a reference to {@code name} in the active scope. A resolved
     * reference inherits the declaration's classifications and points back at it.
     */
    public void reference(String name, Identifier node, IdentifierRole.Reference role) {
        if (!enabled || name == null || name.isEmpty() || node == null) {
            return;
        }
        Scope scope = scopeStack.peek();
        String scopeId = scope != null ? scope.id() : null;
        Occurrence declaration = lookup(name);

        List<String> tags = new ArrayList<>();
        if (declaration != null) {
            for (String classification : declaration.classifications()) {
                if (!classification.equals("identifier") && !classification.equals("declaration")) {
                    tags.add(classification);
                }
            }
        }
        tags.addAll(role.tags());
        List<String> classifications = buildClassifications(role.kind(), tags, false);

        node.setScopeId(scopeId);
        node.setClassifications(classifications);
        node.setDeclaration(declaration != null ? toRef(declaration) : null);

        if (scope != null) {
            scope.record(new Occurrence(Occurrence.Kind.REFERENCE, name, scopeId, classifications,
                declaration != null ? toRef(declaration) : null, copyOf(node.start()), copyOf(node.end())));
        }
    }

    /**
     * Resolves {@code name} through the active scope stack, innermost first.
     *
     * @return the declaration occurrence, or {@code null} when unresolved or disabled
     */
    public Occurrence lookup(String name) {
        if (!enabled || name == null) {
            return null;
        }
        for (Scope scope : scopeStack) {
            Occurrence declaration = scope.declaration(name);
            if (declaration != null) {
                return declaration;
            }
        }
        return null;
    }

    public List<ScopeOccurrences> exportOccurrences() {
        return exportOccurrences(true);
    }

    /**
     * Every name recorded per scope, in scope creation order. Returned occurrences are
     * copies; mutating them does not affect the tracker.
     */
    public List<ScopeOccurrences> exportOccurrences(boolean includeReferences) {
        List<ScopeOccurrences> results = new ArrayList<>();
        if (!enabled) {
            return results;
        }
        for (Scope scope : scopesById.values()) {
            List<ScopeOccurrences.IdentifierOccurrences> identifiers = new ArrayList<>();
            for (Map.Entry<String, Scope.Entry> entry : scope.occurrences().entrySet()) {
                List<Occurrence> declarations = copyAll(entry.getValue().declarations);
                List<Occurrence> references = includeReferences ? copyAll(entry.getValue().references) : List.of();
                if (declarations.isEmpty() && references.isEmpty()) {
                    continue;
                }
                identifiers.add(new ScopeOccurrences.IdentifierOccurrences(entry.getKey(), declarations, references));
            }
            if (!identifiers.isEmpty()) {
                results.add(new ScopeOccurrences(scope.id(), scope.kind(), identifiers));
            }
        }
        return results;
    }

    private Scope resolveScopeOverride(String scopeOverride) {
        Scope current = scopeStack.peek();
        if (scopeOverride == null) {
            return current;
        }
        if (IdentifierRole.GLOBAL_SCOPE.equals(scopeOverride)) {
            return rootScope != null ? rootScope : current;
        }
        for (Iterator<Scope> it = scopeStack.iterator(); it.hasNext(); ) {
            Scope scope = it.next();
            if (scope.id().equals(scopeOverride)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope override '" + scopeOverride
            + "'. Expected '" + IdentifierRole.GLOBAL_SCOPE + "' or an active scope id.");
    }

    private static List<String> buildClassifications(RoleKind kind, List<String> tags, boolean declaration) {
        Set<String> classifications = new LinkedHashSet<>();
        classifications.add("identifier");
        classifications.add(declaration ? "declaration" : "reference");
        if (kind != null) {
            classifications.add(kind.value());
        }
        for (String tag : tags) {
            if (tag != null && !tag.isEmpty()) {
                classifications.add(tag);
            }
        }
        return List.copyOf(classifications);
    }

    private static DeclarationRef toRef(Occurrence declaration) {
        return new DeclarationRef(declaration.scopeId(), copyOf(declaration.start()), copyOf(declaration.end()));
    }

    private static Location copyOf(Location location) {
        return location == null ? null : location.copy();
    }

    private static List<Occurrence> copyAll(List<Occurrence> occurrences) {
        List<Occurrence> copies = new ArrayList<>(occurrences.size());
        for (Occurrence occurrence : occurrences) {
            copies.add(occurrence.copy());
        }
        return copies;
    }
}
