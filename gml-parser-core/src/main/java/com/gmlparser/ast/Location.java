package com.gmlparser.ast;

import java.util.Objects;

/**
 * A position in the source text. {@code index} is a character offset; {@code line} is
 * 1-based and may be absent.
 *
 * <p>Mutable so the location remapper can translate offsets in place once the tree
 * is built.</p>
 */
public final class Location {
    private Integer line;
    private int index;

    public Location(Integer line, int index) {
        this.line = line;
        this.index = index;
    }

    public Integer line() {
        return line;
    }

    public int index() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public Location copy() {
        return new Location(line, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location other)) return false;
        return index == other.index && Objects.equals(line, other.line);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, index);
    }

    @Override
    public String toString() {
        return "{line=" + line + ", index=" + index + "}";
    }
}
