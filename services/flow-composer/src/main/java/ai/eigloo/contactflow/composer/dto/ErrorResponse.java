package ai.eigloo.contactflow.composer.dto;

/**
 * Body of every 4xx response.
 */
public class ErrorResponse {

    private String code;
    private String message;
    private String nodeId;

    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message, String nodeId) {
        this.code = code;
        this.message = message;
        this.nodeId = nodeId;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }
}
