package com.gmlparser.json;

import com.gmlparser.ast.Node;
import com.gmlparser.ast.Program;

/**
 * Reads AST JSON back into nodes. Node kinds are resolved from the {@code type} property.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if {@code json} is malformed or not a {@code Program}
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * @throws AstJsonException if {@code json} is malformed or not a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
