package com.gmlparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = GmlJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class GmlJackson {

    private GmlJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Leaves out null fields, except the ones printers rely on (see AstModule)
     * - Ignores properties it does not know, such as annotations added by later tools
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Specific null fields (alternate, init, ...) are included via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
