package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when the designated entry node is unset or does not exist.
 */
public class MissingEntryNodeException extends FlowGraphException {

    public MissingEntryNodeException(String entryNodeId) {
        super(FlowErrorCode.MISSING_ENTRY_NODE, entryNodeId,
                entryNodeId == null || entryNodeId.isEmpty()
                        ? "Flow has no entry node"
                        : "Entry node '" + entryNodeId + "' does not exist");
    }
}
