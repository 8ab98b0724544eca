package com.gmlparser.scope;

import com.gmlparser.ast.Identifier;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names declared with global scope during one parse ({@code globalvar}, {@code #macro}).
 *
 * <p>Every identifier built is registered here, so marking a name global also flags the
 * identifiers with that name that were visited before the declaration. Once a name is
 * global its identifiers are flagged on registration and no longer retained.</p>
 */
public class GlobalIdentifierRegistry {
    private final Set<String> globalNames = new HashSet<>();
    private final Map<String, Set<Identifier>> pending = new HashMap<>();

    /**
     * Declares {@code node}'s name global and flags every identifier with that name seen so far.
     */
    public void markGlobalIdentifier(Identifier node) {
        if (node == null || node.name() == null || node.name().isEmpty()) {
            return;
        }
        globalNames.add(node.name());
        node.setGlobalIdentifier(true);
        Set<Identifier> earlier = pending.remove(node.name());
        if (earlier != null) {
            for (Identifier identifier : earlier) {
                identifier.setGlobalIdentifier(true);
            }
        }
    }

    /**
     * Registers {@code node} and flags it when its name is already known to be global.
     * Idempotent.
     */
    public void applyGlobalIdentifiersToNode(Identifier node) {
        if (node == null || node.name() == null) {
            return;
        }
        if (globalNames.contains(node.name())) {
            node.setGlobalIdentifier(true);
            return;
        }
        pending.computeIfAbsent(node.name(), k -> Collections.newSetFromMap(new IdentityHashMap<>()))
            .add(node);
    }

    public boolean isGlobal(String name) {
        return globalNames.contains(name);
    }

    public Set<String> globalNames() {
        return Set.copyOf(globalNames);
    }

    int pendingCount(String name) {
        Set<Identifier> nodes = pending.get(name);
        return nodes == null ? 0 : nodes.size();
    }
}
