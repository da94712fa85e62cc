package com.mathc.json;

import com.mathc.Token;
import com.mathc.ast.Ast;

import java.util.List;

/**
 * Converts arenas and token lists to JSON.
 *
 * <p>An AST is written as its root index plus the arena in order. Child
 * references are arena indices, so the output is as flat as the arena.</p>
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if serialization fails
     */
    String serialize(Ast ast) throws AstJsonException;

    /**
     * Same as {@link #serialize(Ast)}, indented for humans.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Ast ast) throws AstJsonException;

    /**
     * @throws AstJsonException if serialization fails
     */
    String serializeTokens(List<Token> tokens) throws AstJsonException;
}
