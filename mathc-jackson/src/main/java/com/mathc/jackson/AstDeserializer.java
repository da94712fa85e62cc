package com.mathc.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.mathc.ast.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds an arena by replaying the serialized nodes through the
 * {@link Ast} add methods. Anything the arena would refuse (a child that
 * does not precede its parent, an unreduced rational, an unknown kind) is
 * reported as a mapping error naming the node index.
 */
public class AstDeserializer extends StdDeserializer<Ast> {

    public AstDeserializer() {
        super(Ast.class);
    }

    @Override
    public Ast deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = p.getCodec().readTree(p);
        JsonNode nodes = tree.path("nodes");
        if (!nodes.isArray()) {
            throw JsonMappingException.from(p, "Expected a 'nodes' array");
        }

        Ast ast = new Ast(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            try {
                addNode(ast, nodes.get(i));
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Invalid node #" + i + ": " + e.getMessage(), e);
            }
        }

        try {
            ast.setRoot(new NodeId(requireInt(tree, "root")));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid root: " + e.getMessage(), e);
        }
        return ast;
    }

    private static void addNode(Ast ast, JsonNode json) {
        int position = requireInt(json, "position");
        String type = requireText(json, "type");
        switch (type) {
            case "Constant":
                ast.addConstant(ConstantKind.valueOf(requireText(json, "kind")), position);
                break;
            case "Real":
                ast.addReal(RealNumberSerializer.fromJson(require(json, "value")), position);
                break;
            case "Rational": {
                long numerator = requireLong(json, "numerator");
                long denominator = requireLong(json, "denominator");
                Rational added = (Rational) ast.at(ast.addRational(numerator, denominator, position));
                if (added.numerator() != numerator || added.denominator() != denominator) {
                    throw new IllegalArgumentException(
                        "Rational " + numerator + "/" + denominator + " is not in lowest terms");
                }
                break;
            }
            case "Identifier":
                ast.addIdentifier(requireText(json, "name"), position);
                break;
            case "BinaryOp":
                ast.addBinaryOp(BinaryOpKind.valueOf(requireText(json, "kind")),
                    child(json, "left"), child(json, "right"), position);
                break;
            case "UnaryOp":
                ast.addUnaryOp(UnaryOpKind.valueOf(requireText(json, "kind")), child(json, "inner"), position);
                break;
            case "Call": {
                JsonNode args = require(json, "arguments");
                if (!args.isArray()) {
                    throw new IllegalArgumentException("'arguments' must be an array");
                }
                List<NodeId> arguments = new ArrayList<>();
                for (JsonNode arg : args) {
                    if (!arg.canConvertToInt()) {
                        throw new IllegalArgumentException("Argument handle must be an integer, got " + arg);
                    }
                    arguments.add(new NodeId(arg.intValue()));
                }
                ast.addCall(FunctionKind.valueOf(requireText(json, "function")), arguments, position);
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown node type '" + type + "'");
        }
    }

    private static NodeId child(JsonNode json, String field) {
        return new NodeId(requireInt(json, field));
    }

    private static JsonNode require(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode json, String field) {
        JsonNode value = require(json, field);
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    private static int requireInt(JsonNode json, String field) {
        JsonNode value = require(json, field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Field '" + field + "' must be an int");
        }
        return value.intValue();
    }

    private static long requireLong(JsonNode json, String field) {
        JsonNode value = require(json, field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new IllegalArgumentException("Field '" + field + "' must be a long");
        }
        return value.longValue();
    }
}
