package com.mathc.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes doubles so they survive a round trip through plain JSON.
 * Finite values are written as numbers, NaN and the infinities as the
 * strings Java's {@link Double#toString(double)} produces for them.
 */
public class RealNumberSerializer extends StdSerializer<Double> {

    public RealNumberSerializer() {
        super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (Double.isFinite(value)) {
            gen.writeNumber(value);
        } else {
            gen.writeString(value.toString());
        }
    }

    static JsonNode toJson(double value) {
        if (Double.isFinite(value)) {
            return JsonNodeFactory.instance.numberNode(value);
        }
        return JsonNodeFactory.instance.textNode(Double.toString(value));
    }

    /**
     * Reads a value written by this serializer.
     *
     * @throws IllegalArgumentException if the node is neither a number nor one
     *         of the non-finite names
     */
    static double fromJson(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Not a real number: " + node);
    }
}
