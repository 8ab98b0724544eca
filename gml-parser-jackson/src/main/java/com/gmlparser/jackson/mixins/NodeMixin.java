package com.gmlparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic handling for every node type: the kind name is written as {@code "type"},
 * ahead of all other properties, and read back to pick the concrete class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public interface NodeMixin {
}
