package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when two ERROR edges from one node share an error code.
 */
public class DuplicateErrorCodeException extends FlowGraphException {

    private final String errorCode;

    public DuplicateErrorCodeException(String nodeId, String errorCode) {
        super(FlowErrorCode.DUPLICATE_ERROR_CODE, nodeId,
                "Node '" + nodeId + "' already handles error '" + errorCode + "'");
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
