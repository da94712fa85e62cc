package com.mathc.json;

import com.mathc.ast.Ast;

/**
 * Rebuilds arenas from the JSON written by {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes an AST. Nodes are re-added one by one, so a document that
     * breaks the arena invariants (forward child references, unreduced
     * rationals, a missing root) is rejected.
     *
     * @param json the JSON string to deserialize
     * @return a new arena with its root set
     * @throws AstJsonException if the document is malformed or invalid
     */
    Ast deserialize(String json) throws AstJsonException;
}
