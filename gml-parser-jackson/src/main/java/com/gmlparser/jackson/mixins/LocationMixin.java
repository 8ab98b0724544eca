package com.gmlparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * {@code {"line": 3, "index": 42}}. The line is written even when absent.
 */
@JsonPropertyOrder({"line", "index"})
public abstract class LocationMixin {

    @JsonCreator
    LocationMixin(@JsonProperty("line") Integer line, @JsonProperty("index") int index) {
    }

    @JsonProperty("line")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    abstract Integer line();

    @JsonProperty("index")
    abstract int index();
}
