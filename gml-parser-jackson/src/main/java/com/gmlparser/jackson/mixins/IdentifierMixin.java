package com.gmlparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gmlparser.ast.DeclarationRef;
import com.gmlparser.ast.Location;

import java.util.List;

/**
 * Identifier is a class rather than a record, so its accessors are named here. Scope
 * metadata is written only when present, except {@code declaration}, which printers
 * look for even when it is null.
 */
@JsonPropertyOrder({"start", "end", "name", "isGlobalIdentifier", "scopeId", "classifications", "declaration"})
public abstract class IdentifierMixin {

    @JsonCreator
    IdentifierMixin(@JsonProperty("start") Location start,
                    @JsonProperty("end") Location end,
                    @JsonProperty("name") String name) {
    }

    @JsonProperty("start")
    abstract Location start();

    @JsonProperty("end")
    abstract Location end();

    @JsonProperty("name")
    abstract String name();

    @JsonProperty("isGlobalIdentifier")
    abstract boolean isGlobalIdentifier();

    @JsonProperty("isGlobalIdentifier")
    abstract void setGlobalIdentifier(boolean globalIdentifier);

    @JsonProperty("scopeId")
    abstract String scopeId();

    @JsonProperty("scopeId")
    abstract void setScopeId(String scopeId);

    @JsonProperty("classifications")
    abstract List<String> classifications();

    @JsonProperty("classifications")
    abstract void setClassifications(List<String> classifications);

    @JsonProperty("declaration")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    abstract DeclarationRef declaration();

    @JsonProperty("declaration")
    abstract void setDeclaration(DeclarationRef declaration);
}
