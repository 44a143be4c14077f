package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when a transition entry cannot be mapped to any edge kind.
 */
public class UnknownTransitionKeyException extends FlowGraphException {

    private final String key;

    public UnknownTransitionKeyException(String nodeId, String key, String reason) {
        super(FlowErrorCode.UNKNOWN_TRANSITION_KEY, nodeId,
                "Transition key '" + key + "' on node '" + nodeId + "' cannot be mapped: " + reason);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
