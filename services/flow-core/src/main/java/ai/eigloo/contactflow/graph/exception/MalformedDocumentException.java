package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when a wire document lacks a required field or has one of the wrong shape.
 */
public class MalformedDocumentException extends FlowGraphException {

    private final String pointer;

    public MalformedDocumentException(String pointer, String message) {
        this(null, pointer, message);
    }

    public MalformedDocumentException(String nodeId, String pointer, String message) {
        super(FlowErrorCode.MALFORMED_DOCUMENT, nodeId, message + " at " + pointer);
        this.pointer = pointer;
    }

    /**
     * JSON pointer of the offending location.
     */
    public String getPointer() {
        return pointer;
    }
}
