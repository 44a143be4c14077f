package ai.eigloo.contactflow.graph.exception;

import ai.eigloo.contactflow.graph.model.EdgeKind;

/**
 * Thrown when a second SEQUENTIAL or DEFAULT edge is added from the same node.
 */
public class DuplicateEdgeKindException extends FlowGraphException {

    private final EdgeKind kind;
    private final String existingTarget;

    public DuplicateEdgeKindException(String nodeId, EdgeKind kind, String existingTarget) {
        super(FlowErrorCode.DUPLICATE_EDGE_KIND, nodeId,
                "Node '" + nodeId + "' already has a " + kind + " transition to '" + existingTarget + "'");
        this.kind = kind;
        this.existingTarget = existingTarget;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public String getExistingTarget() {
        return existingTarget;
    }
}
