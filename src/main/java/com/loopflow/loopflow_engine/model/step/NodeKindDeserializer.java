package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads a node kind by looking at its "type" field and binding the rest of the object to
 * the record that type names. Applied on the property, not on {@link NodeKind} itself,
 * so binding the concrete record does not come back here.
 */
public class NodeKindDeserializer extends StdDeserializer<NodeKind> {

    public NodeKindDeserializer() {
        super(NodeKind.class);
    }

    @Override
    public NodeKind deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode tree = ctxt.readTree(parser);
        JsonNode typeNode = tree.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            return ctxt.reportInputMismatch(NodeKind.class, "Node kind has no \"type\" field");
        }
        String typeName = typeNode.asText();
        if (!NodeType.isKnown(typeName)) {
            return ctxt.reportInputMismatch(NodeKind.class, "Unknown node type: '%s'", typeName);
        }
        NodeType type = NodeType.fromJson(typeName);
        return ctxt.readTreeAsValue(tree, type.getKindClass());
    }
}
