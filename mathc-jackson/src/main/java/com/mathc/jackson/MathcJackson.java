package com.mathc.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that understand arenas and tokens.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = MathcJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(ast);
 * Ast copy = mapper.readValue(json, Ast.class);
 * </pre>
 */
public final class MathcJackson {

    private MathcJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Writes an Ast as {"root": i, "nodes": [...]} with index-based child references
     * - Writes tokens with their numeric payload flattened
     * - Writes non-finite reals as the strings "NaN", "Infinity", "-Infinity"
     * - Ignores unknown properties when reading
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
