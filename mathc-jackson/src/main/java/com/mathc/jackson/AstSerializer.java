package com.mathc.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.mathc.ast.Ast;
import com.mathc.ast.AstNode;

import java.io.IOException;

/**
 * Writes an arena as {"root": i, "nodes": [...]}, nodes in arena order.
 * An arena whose root was never set is written with root -1.
 */
public class AstSerializer extends StdSerializer<Ast> {

    public AstSerializer() {
        super(Ast.class);
    }

    @Override
    public void serialize(Ast ast, JsonGenerator gen, SerializerProvider provider) throws IOException {
        NodeJsonWriter writer = new NodeJsonWriter();
        gen.writeStartObject();
        gen.writeNumberField("root", ast.root().index());
        gen.writeArrayFieldStart("nodes");
        for (AstNode node : ast.nodes()) {
            gen.writeTree(node.accept(writer));
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
