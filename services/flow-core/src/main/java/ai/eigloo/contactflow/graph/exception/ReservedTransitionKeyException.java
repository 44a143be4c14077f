package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when a condition match value collides with one of the fixed
 * transition keys of the wire format.
 */
public class ReservedTransitionKeyException extends FlowGraphException {

    private final String matchValue;

    public ReservedTransitionKeyException(String nodeId, String matchValue) {
        super(FlowErrorCode.RESERVED_TRANSITION_KEY, nodeId,
                "Condition value '" + matchValue + "' on node '" + nodeId + "' is a reserved transition key");
        this.matchValue = matchValue;
    }

    public String getMatchValue() {
        return matchValue;
    }
}
