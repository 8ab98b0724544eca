package com.gmlparser.scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Scope {
    private final String id;
    private final ScopeKind kind;
    private final Map<String, Occurrence> declarations = new LinkedHashMap<>();
    private final Map<String, Entry> occurrences = new LinkedHashMap<>();

    Scope(String id, ScopeKind kind) {
        this.id = id;
        this.kind = kind;
    }

    String id() {
        return id;
    }

    ScopeKind kind() {
        return kind;
    }

    Occurrence declaration(String name) {
        return declarations.get(name);
    }

    void storeDeclaration(String name, Occurrence declaration) {
        declarations.put(name, declaration);
    }

    void record(Occurrence occurrence) {
        Entry entry = occurrences.computeIfAbsent(occurrence.name(), k -> new Entry());
        if (occurrence.kind() == Occurrence.Kind.REFERENCE) {
            entry.references.add(occurrence);
        } else {
            entry.declarations.add(occurrence);
        }
    }

    Map<String, Entry> occurrences() {
        return occurrences;
    }

    static final class Entry {
        final List<Occurrence> declarations = new ArrayList<>();
        final List<Occurrence> references = new ArrayList<>();
    }
}
