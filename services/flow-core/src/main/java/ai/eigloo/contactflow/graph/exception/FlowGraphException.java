package ai.eigloo.contactflow.graph.exception;

/**
 * Base class for structural errors raised while building, compiling or
 * decompiling a flow graph.
 *
 * <p>These are programming-time or data errors. They abort the operation in
 * progress and are never retried internally.</p>
 */
public abstract class FlowGraphException extends RuntimeException {

    private final FlowErrorCode code;
    private final String nodeId;

    protected FlowGraphException(FlowErrorCode code, String nodeId, String message) {
        super(message);
        this.code = code;
        this.nodeId = nodeId;
    }

    public FlowErrorCode getCode() {
        return code;
    }

    /**
     * Node the error is attributed to, or {@code null} for graph-level errors.
     */
    public String getNodeId() {
        return nodeId;
    }
}
