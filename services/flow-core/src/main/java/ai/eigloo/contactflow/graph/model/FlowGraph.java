package ai.eigloo.contactflow.graph.model;

import ai.eigloo.contactflow.graph.exception.DuplicateNodeIdException;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a complete flow: nodes, id-keyed edges and the entry node.
 *
 * <p>Node ids are unique and per-node transition rules hold. Edge endpoints
 * are not resolved here; forward references are legal until compile time.</p>
 *
 * @param name flow name, may be {@code null} for third-party documents without one
 * @param description optional flow description
 * @param version wire schema version
 * @param entryNodeId id of the node execution starts at
 * @param nodes nodes in insertion order
 * @param edges edges in insertion order
 * @param extensions unrecognized top-level document fields, passed through
 */
public record FlowGraph(
        String name,
        String description,
        String version,
        String entryNodeId,
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        Map<String, JsonNode> extensions
) {

    private static final Comparator<GraphEdge> CANONICAL_ORDER = Comparator.comparing(GraphEdge::kind);

    public FlowGraph {
        if (nodes == null) {
            throw new IllegalArgumentException("Nodes cannot be null");
        }
        if (edges == null) {
            throw new IllegalArgumentException("Edges cannot be null");
        }
        if (version == null || version.isBlank()) {
            version = WireFields.DEFAULT_VERSION;
        }

        Set<String> ids = new LinkedHashSet<>();
        for (GraphNode node : nodes) {
            if (!ids.add(node.id())) {
                throw new DuplicateNodeIdException(node.id());
            }
        }
        Map<String, List<GraphEdge>> bySource = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            List<GraphEdge> siblings = bySource.computeIfAbsent(edge.from(), k -> new ArrayList<>());
            TransitionRules.checkAddable(siblings, edge);
            siblings.add(edge);
        }

        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        extensions = FlowJson.frozenCopy(extensions);
    }

    public FlowGraph(String name, String entryNodeId, List<GraphNode> nodes, List<GraphEdge> edges) {
        this(name, null, WireFields.DEFAULT_VERSION, entryNodeId, nodes, edges, Map.of());
    }

    /**
     * Copy of the extension fields; values are deep copies.
     */
    @Override
    public Map<String, JsonNode> extensions() {
        return FlowJson.frozenCopy(extensions);
    }

    /**
     * Returns the node with the given id, or {@code null}.
     */
    public GraphNode getNode(String id) {
        for (GraphNode node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public boolean containsNode(String id) {
        return getNode(id) != null;
    }

    public GraphNode getEntryNode() {
        return entryNodeId == null ? null : getNode(entryNodeId);
    }

    /**
     * Node ids in insertion order.
     */
    public Set<String> nodeIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (GraphNode node : nodes) {
            ids.add(node.id());
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * Id-keyed node table in insertion order.
     */
    public Map<String, GraphNode> nodeIndex() {
        Map<String, GraphNode> index = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            index.put(node.id(), node);
        }
        return Collections.unmodifiableMap(index);
    }

    /**
     * Outgoing edges of one node in canonical order: SEQUENTIAL, CONDITION,
     * DEFAULT, ERROR, insertion order within a kind.
     */
    public List<GraphEdge> outgoing(String nodeId) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges) {
            if (edge.from().equals(nodeId)) {
                result.add(edge);
            }
        }
        result.sort(CANONICAL_ORDER);
        return result;
    }

    /**
     * Outgoing edges for every source id, each list in canonical order.
     * Built in one pass for callers that walk the whole graph.
     */
    public Map<String, List<GraphEdge>> outgoingBySource() {
        Map<String, List<GraphEdge>> bySource = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            bySource.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
        bySource.values().forEach(list -> list.sort(CANONICAL_ORDER));
        return bySource;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
