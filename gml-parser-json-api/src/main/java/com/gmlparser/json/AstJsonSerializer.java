package com.gmlparser.json;

import com.gmlparser.ast.Node;

/**
 * Writes AST nodes in the wire shape downstream tools read: {@code type} first, then
 * {@code start}/{@code end} as {@code {line, index}}, then the node's own fields.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)}, indented.
     */
    String serializePretty(Node node) throws AstJsonException;
}
