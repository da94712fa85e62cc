package com.mathc.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathc.Token;
import com.mathc.ast.Ast;
import com.mathc.json.AstJsonDeserializer;
import com.mathc.json.AstJsonException;
import com.mathc.json.AstJsonProvider;
import com.mathc.json.AstJsonSerializer;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this.mapper = MathcJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Ast ast) throws AstJsonException {
            try {
                return mapper.writeValueAsString(ast);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }

        @Override
        public String serializePretty(Ast ast) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(ast);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }

        @Override
        public String serializeTokens(List<Token> tokens) throws AstJsonException {
            try {
                return mapper.writeValueAsString(tokens);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize tokens", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Ast deserialize(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, Ast.class);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize AST", e);
            }
        }
    }
}
