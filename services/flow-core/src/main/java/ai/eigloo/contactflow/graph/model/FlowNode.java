package ai.eigloo.contactflow.graph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Contract every flow node satisfies: a stable id, a block type tag and an
 * open, ordered parameter bag. The core never interprets parameter contents.
 */
public interface FlowNode {

    String id();

    String type();

    Map<String, JsonNode> parameters();

    /**
     * Node-record fields the wire schema does not name, kept verbatim so a
     * decompile/recompile cycle loses nothing.
     */
    default Map<String, JsonNode> extraFields() {
        return Map.of();
    }
}
