package ai.eigloo.contactflow.graph.model;

import ai.eigloo.contactflow.graph.wire.FlowJson;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Immutable snapshot of a flow node as held by a built {@link FlowGraph}.
 *
 * @param id stable node identifier
 * @param type block type tag
 * @param parameters ordered parameter bag
 * @param extraFields unrecognized node-record fields, passed through
 */
public record GraphNode(
        String id,
        String type,
        Map<String, JsonNode> parameters,
        Map<String, JsonNode> extraFields
) implements FlowNode {

    public GraphNode {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("Node type cannot be null or empty");
        }
        parameters = FlowJson.frozenCopy(parameters);
        extraFields = FlowJson.frozenCopy(extraFields);
    }

    public static GraphNode copyOf(FlowNode node) {
        if (node instanceof GraphNode snapshot) {
            return snapshot;
        }
        return new GraphNode(node.id(), node.type(), node.parameters(), node.extraFields());
    }

    /**
     * Copy of the parameter bag. Values are deep copies, so changing them
     * never reaches the snapshot.
     */
    @Override
    public Map<String, JsonNode> parameters() {
        return FlowJson.frozenCopy(parameters);
    }

    @Override
    public Map<String, JsonNode> extraFields() {
        return FlowJson.frozenCopy(extraFields);
    }

    /**
     * Returns a copy of one parameter value, or {@code null} when absent.
     */
    public JsonNode parameter(String key) {
        JsonNode value = parameters.get(key);
        return value == null ? null : value.deepCopy();
    }

    /**
     * Returns the parameter as text, or {@code null} when absent or not a string.
     */
    public String textParameter(String key) {
        JsonNode value = parameters.get(key);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
