package ai.eigloo.contactflow.graph.model;

/**
 * Directed, typed transition between two nodes, referenced by id.
 *
 * @param from source node id
 * @param kind transition kind
 * @param label match value for CONDITION, error code for ERROR, otherwise {@code null}
 * @param to target node id; may be a forward reference until compile time
 */
public record GraphEdge(
        String from,
        EdgeKind kind,
        String label,
        String to
) {
    public GraphEdge {
        if (from == null || from.trim().isEmpty()) {
            throw new IllegalArgumentException("Edge source cannot be null or empty");
        }
        if (to == null || to.trim().isEmpty()) {
            throw new IllegalArgumentException("Edge target cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Edge kind cannot be null");
        }
        if (kind.isLabeled() && (label == null || label.isEmpty())) {
            throw new IllegalArgumentException(kind + " edge from '" + from + "' requires a label");
        }
        if (!kind.isLabeled() && label != null) {
            throw new IllegalArgumentException(kind + " edge from '" + from + "' cannot carry a label");
        }
    }

    public static GraphEdge sequential(String from, String to) {
        return new GraphEdge(from, EdgeKind.SEQUENTIAL, null, to);
    }

    public static GraphEdge condition(String from, String matchValue, String to) {
        return new GraphEdge(from, EdgeKind.CONDITION, matchValue, to);
    }

    public static GraphEdge otherwise(String from, String to) {
        return new GraphEdge(from, EdgeKind.DEFAULT, null, to);
    }

    public static GraphEdge error(String from, String errorCode, String to) {
        return new GraphEdge(from, EdgeKind.ERROR, errorCode, to);
    }
}
