package com.gmlparser.scope;

public enum ScopeKind {
    PROGRAM("program"),
    FUNCTION("function"),
    STRUCT("struct"),
    WITH("with"),
    CATCH("catch");

    private final String value;

    ScopeKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
