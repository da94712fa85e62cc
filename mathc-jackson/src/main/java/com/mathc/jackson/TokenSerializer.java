package com.mathc.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.mathc.NumericValue;
import com.mathc.Token;

import java.io.IOException;

/**
 * Writes a token as {"type", "lexeme", "position"} plus, for numbers,
 * "value" and "integer".
 */
public class TokenSerializer extends StdSerializer<Token> {

    private static final RealNumberSerializer REAL = new RealNumberSerializer();

    public TokenSerializer() {
        super(Token.class);
    }

    @Override
    public void serialize(Token token, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", token.type().name());
        gen.writeStringField("lexeme", token.lexeme());
        gen.writeNumberField("position", token.position());

        NumericValue number = token.number();
        if (number != null) {
            gen.writeFieldName("value");
            if (number.isInteger()) {
                gen.writeNumber(number.longValue());
            } else {
                REAL.serialize(number.doubleValue(), gen, provider);
            }
            gen.writeBooleanField("integer", number.isInteger());
        }
        gen.writeEndObject();
    }
}
