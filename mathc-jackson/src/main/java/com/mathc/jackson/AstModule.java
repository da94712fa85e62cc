package com.mathc.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.mathc.Token;
import com.mathc.ast.Ast;

/**
 * Jackson module that registers the arena and token (de)serializers.
 *
 * This module handles:
 * - Ast to {"root", "nodes"} and back, re-validating arena order on read
 * - Token to a flat object with the numeric payload inlined
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, null, "com.mathc", "mathc-jackson"));

        addSerializer(Ast.class, new AstSerializer());
        addDeserializer(Ast.class, new AstDeserializer());
        addSerializer(Token.class, new TokenSerializer());
    }
}
