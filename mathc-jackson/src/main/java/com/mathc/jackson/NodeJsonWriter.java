package com.mathc.jackson;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathc.ast.*;

/**
 * Converts a single node to its JSON object. Child handles are written as
 * plain arena indices.
 */
class NodeJsonWriter implements AstVisitor<ObjectNode> {

    private final JsonNodeFactory factory = JsonNodeFactory.instance;

    private ObjectNode start(AstNode node) {
        ObjectNode json = factory.objectNode();
        json.put("type", node.type());
        json.put("position", node.position());
        return json;
    }

    @Override
    public ObjectNode visitConstant(Constant node) {
        return start(node).put("kind", node.kind().name());
    }

    @Override
    public ObjectNode visitReal(Real node) {
        ObjectNode json = start(node);
        json.set("value", RealNumberSerializer.toJson(node.value()));
        return json;
    }

    @Override
    public ObjectNode visitRational(Rational node) {
        return start(node)
            .put("numerator", node.numerator())
            .put("denominator", node.denominator());
    }

    @Override
    public ObjectNode visitIdentifier(Identifier node) {
        return start(node).put("name", node.name());
    }

    @Override
    public ObjectNode visitBinaryOp(BinaryOp node) {
        return start(node)
            .put("kind", node.kind().name())
            .put("left", node.left().index())
            .put("right", node.right().index());
    }

    @Override
    public ObjectNode visitUnaryOp(UnaryOp node) {
        return start(node)
            .put("kind", node.kind().name())
            .put("inner", node.inner().index());
    }

    @Override
    public ObjectNode visitCall(Call node) {
        ObjectNode json = start(node).put("function", node.function().name());
        ArrayNode arguments = json.putArray("arguments");
        for (NodeId argument : node.arguments()) {
            arguments.add(argument.index());
        }
        return json;
    }
}
