package ai.eigloo.contactflow.graph.layout;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.exception.MissingEntryNodeException;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered breadth-first layout.
 *
 * <p>A node's column is its BFS depth from the entry node; the first visit
 * wins, so the rank is the shortest-path distance. Within a column nodes are
 * stacked in discovery order. Successors of one node are discovered in
 * canonical transition order. Unreachable nodes go into one extra trailing
 * column in insertion order and are reported as warnings.</p>
 *
 * <p>Runs in O(nodes + edges) and terminates on cyclic graphs. Edges whose
 * target is not in the graph are skipped; the compiler rejects them
 * before layout.</p>
 */
public class LayoutEngine {

    private static final Logger logger = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutSettings settings;

    public LayoutEngine() {
        this(LayoutSettings.defaults());
    }

    public LayoutEngine(LayoutSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Layout settings cannot be null");
        }
        this.settings = settings;
    }

    public LayoutSettings getSettings() {
        return settings;
    }

    /**
     * @throws MissingEntryNodeException if the graph has nodes but its entry id does not resolve
     */
    public FlowLayout layout(FlowGraph graph) {
        if (graph.isEmpty()) {
            return FlowLayout.empty();
        }
        Map<String, GraphNode> index = graph.nodeIndex();
        if (graph.entryNodeId() == null || !index.containsKey(graph.entryNodeId())) {
            throw new MissingEntryNodeException(graph.entryNodeId());
        }

        Map<String, List<GraphEdge>> outgoing = graph.outgoingBySource();
        Map<String, Integer> ranks = new LinkedHashMap<>();
        List<List<String>> columns = new ArrayList<>();

        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(graph.entryNodeId());
        visited.add(graph.entryNodeId());
        ranks.put(graph.entryNodeId(), 0);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int rank = ranks.get(current);
            if (columns.size() == rank) {
                columns.add(new ArrayList<>());
            }
            columns.get(rank).add(current);

            for (GraphEdge edge : outgoing.getOrDefault(current, List.of())) {
                String target = edge.to();
                if (!index.containsKey(target) || !visited.add(target)) {
                    continue;
                }
                ranks.put(target, rank + 1);
                queue.add(target);
            }
        }

        Map<String, Position> positions = new LinkedHashMap<>();
        for (int rank = 0; rank < columns.size(); rank++) {
            List<String> column = columns.get(rank);
            for (int row = 0; row < column.size(); row++) {
                positions.put(column.get(row), place(rank, row));
            }
        }

        List<String> orphans = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        int orphanRank = columns.size();
        for (String id : index.keySet()) {
            if (visited.contains(id)) {
                continue;
            }
            positions.put(id, place(orphanRank, orphans.size()));
            ranks.put(id, orphanRank);
            orphans.add(id);
            diagnostics.add(Diagnostic.orphan(id));
        }

        logger.debug("Laid out {} nodes in {} columns ({} orphans)",
                positions.size(), orphans.isEmpty() ? columns.size() : columns.size() + 1, orphans.size());
        return new FlowLayout(positions, ranks, orphans, diagnostics);
    }

    private Position place(int rank, int row) {
        return new Position(
                settings.startX() + rank * settings.columnSpacing(),
                settings.startY() + row * settings.rowSpacing());
    }
}
