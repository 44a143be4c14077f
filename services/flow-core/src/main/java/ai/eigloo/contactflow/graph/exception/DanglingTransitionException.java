package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when a decompiled transition points at an id with no node-record.
 */
public class DanglingTransitionException extends FlowGraphException {

    private final String key;
    private final String targetId;

    public DanglingTransitionException(String nodeId, String key, String targetId) {
        super(FlowErrorCode.DANGLING_TRANSITION, nodeId,
                "Transition '" + key + "' on node '" + nodeId + "' targets unknown node '" + targetId + "'");
        this.key = key;
        this.targetId = targetId;
    }

    public String getKey() {
        return key;
    }

    public String getTargetId() {
        return targetId;
    }
}
