package io.eidos.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eidos.core.model.LanguageDefinition;
import io.eidos.core.model.SyntaxTree;

/** Pretty-printed JSON views of the loaded definition and parsed trees, for {@code -d}. */
final class DebugDump {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private DebugDump() {
        // utility class
    }

    static String definition(LanguageDefinition definition) {
        ObjectNode root = JSON.createObjectNode();
        root.set("statements", JSON.valueToTree(definition.statements()));
        root.set("blocks", JSON.valueToTree(definition.blocks()));
        root.set("operators", JSON.valueToTree(definition.operators()));
        return write(root);
    }

    static String tree(SyntaxTree tree) {
        ObjectNode root = JSON.createObjectNode();
        root.put("source", tree.sourceName());
        root.put("depth", tree.depth());
        root.put("nodeCount", tree.nodeCount());
        root.set("nodes", JSON.valueToTree(tree.nodes()));
        return write(root);
    }

    private static String write(ObjectNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize debug dump", e);
        }
    }
}
