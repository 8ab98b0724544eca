package com.gmlparser.scope;

/**
 * Semantic category of an identifier occurrence. {@link #value()} is the classification
 * string written onto identifiers.
 */
public enum RoleKind {
    VARIABLE("variable"),
    PARAMETER("parameter"),
    MACRO("macro"),
    ENUM("enum"),
    ENUM_MEMBER("enum-member"),
    STRUCT("struct"),
    TYPE("type"),
    PROPERTY("property");

    private final String value;

    RoleKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
