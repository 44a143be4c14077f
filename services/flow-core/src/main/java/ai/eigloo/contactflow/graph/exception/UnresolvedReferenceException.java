package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown at compile time when an edge endpoint names a node that was never added.
 */
public class UnresolvedReferenceException extends FlowGraphException {

    private final String missingId;

    public UnresolvedReferenceException(String nodeId, String missingId) {
        super(FlowErrorCode.UNRESOLVED_REFERENCE, nodeId,
                "Transition from '" + nodeId + "' references non-existent node '" + missingId + "'");
        this.missingId = missingId;
    }

    public String getMissingId() {
        return missingId;
    }
}
