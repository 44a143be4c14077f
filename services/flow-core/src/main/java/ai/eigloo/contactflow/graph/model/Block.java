package ai.eigloo.contactflow.graph.model;

import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable flow node used while authoring a flow.
 *
 * <p>Parameters may still change after the node is registered with a
 * builder; edges refer to the node by id, so they remain valid. A snapshot is
 * taken when the flow is built.</p>
 */
public class Block implements FlowNode {

    private final String id;
    private final String type;
    private final Map<String, JsonNode> parameters = new LinkedHashMap<>();
    private final Map<String, JsonNode> extraFields = new LinkedHashMap<>();

    public Block(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Block id cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("Block type cannot be null or empty");
        }
        this.id = id;
        this.type = type;
    }

    public static Block of(String id, String type) {
        return new Block(id, type);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Map<String, JsonNode> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    @Override
    public Map<String, JsonNode> extraFields() {
        return Collections.unmodifiableMap(extraFields);
    }

    /**
     * Sets a parameter, replacing any previous value for the key.
     *
     * @param key parameter name as the routing engine expects it
     * @param value any value Jackson can turn into a tree; {@link JsonNode}s are copied
     * @return this block
     */
    public Block parameter(String key, Object value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        parameters.put(key, FlowJson.toNode(value));
        return this;
    }

    public Block removeParameter(String key) {
        parameters.remove(key);
        return this;
    }

    public Block extraField(String key, Object value) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Field name cannot be null or empty");
        }
        if (WireFields.RECORD_FIELDS.contains(key)) {
            throw new IllegalArgumentException("Field '" + key + "' is managed by the compiler");
        }
        extraFields.put(key, FlowJson.toNode(value));
        return this;
    }

    @Override
    public String toString() {
        return type + "(" + id + ")";
    }
}
