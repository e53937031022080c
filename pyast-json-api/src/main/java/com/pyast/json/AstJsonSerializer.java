package com.pyast.json;

import com.pyast.ast.Node;

/**
 * Writes syntax trees as JSON for inspection. The layout is diagnostic and may change; nothing
 * reads it back.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree to a compact JSON string.
     *
     * @param node the root to serialize
     * @return the JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node and its subtree to an indented JSON string.
     *
     * @param node the root to serialize
     * @return the pretty-printed JSON representation of the tree
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
