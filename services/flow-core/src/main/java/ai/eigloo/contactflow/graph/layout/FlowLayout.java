package ai.eigloo.contactflow.graph.layout;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of laying out a flow.
 *
 * @param positions coordinate per node id, reachable nodes first in rank order
 * @param ranks BFS depth per node id; orphans share the trailing column's rank
 * @param orphanNodeIds nodes unreachable from the entry node, in insertion order
 * @param diagnostics one orphan warning per unreachable node
 */
public record FlowLayout(
        Map<String, Position> positions,
        Map<String, Integer> ranks,
        List<String> orphanNodeIds,
        List<Diagnostic> diagnostics
) {

    public FlowLayout {
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        ranks = Collections.unmodifiableMap(new LinkedHashMap<>(ranks));
        orphanNodeIds = List.copyOf(orphanNodeIds);
        diagnostics = List.copyOf(diagnostics);
    }

    public static FlowLayout empty() {
        return new FlowLayout(Map.of(), Map.of(), List.of(), List.of());
    }

    public Position positionOf(String nodeId) {
        return positions.get(nodeId);
    }

    public Integer rankOf(String nodeId) {
        return ranks.get(nodeId);
    }

    public boolean isOrphan(String nodeId) {
        return orphanNodeIds.contains(nodeId);
    }
}
