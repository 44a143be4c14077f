package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when a node is registered under an id that is already taken.
 */
public class DuplicateNodeIdException extends FlowGraphException {

    public DuplicateNodeIdException(String nodeId) {
        super(FlowErrorCode.DUPLICATE_NODE_ID, nodeId, "Node id '" + nodeId + "' is already used in this flow");
    }
}
