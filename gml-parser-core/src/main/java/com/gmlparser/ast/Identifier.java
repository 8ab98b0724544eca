package com.gmlparser.ast;

import java.util.List;

/**
 * An identifier occurrence. Unlike the other nodes it is a mutable class: the global
 * identifier registry and the scope tracker annotate it after construction, and a
 * later {@code globalvar} may flag identifiers that were built earlier.
 */
public final class Identifier implements Expression {
    private final Location start;
    private final Location end;
    private final String name;
    private boolean globalIdentifier;
    private String scopeId;
    private List<String> classifications;
    private DeclarationRef declaration;

    public Identifier(Location start, Location end, String name) {
        this.start = start;
        this.end = end;
        this.name = name;
    }

    public Identifier(Span span, String name) {
        this(span.start(), span.end(), name);
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public Location start() {
        return start;
    }

    @Override
    public Location end() {
        return end;
    }

    public String name() {
        return name;
    }

    public boolean isGlobalIdentifier() {
        return globalIdentifier;
    }

    public void setGlobalIdentifier(boolean globalIdentifier) {
        this.globalIdentifier = globalIdentifier;
    }

    public String scopeId() {
        return scopeId;
    }

    public void setScopeId(String scopeId) {
        this.scopeId = scopeId;
    }

    public List<String> classifications() {
        return classifications;
    }

    public void setClassifications(List<String> classifications) {
        this.classifications = classifications == null ? null : List.copyOf(classifications);
    }

    /**
     * The resolved declaration, or {@code null} for unresolved references and when scope
     * tracking is off.
     */
    public DeclarationRef declaration() {
        return declaration;
    }

    public void setDeclaration(DeclarationRef declaration) {
        this.declaration = declaration;
    }

    @Override
    public String toString() {
        return "Identifier[" + name + " " + start + ".." + end + "]";
    }
}
