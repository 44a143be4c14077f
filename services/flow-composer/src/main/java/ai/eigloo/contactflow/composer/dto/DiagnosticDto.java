package ai.eigloo.contactflow.composer.dto;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;

/**
 * Non-fatal finding returned with a compile result.
 */
public class DiagnosticDto {

    private String severity;
    private String code;
    private String nodeId;
    private String message;

    public DiagnosticDto() {
    }

    public DiagnosticDto(String severity, String code, String nodeId, String message) {
        this.severity = severity;
        this.code = code;
        this.nodeId = nodeId;
        this.message = message;
    }

    public static DiagnosticDto from(Diagnostic diagnostic) {
        return new DiagnosticDto(diagnostic.severity().name(), diagnostic.code(),
                diagnostic.nodeId(), diagnostic.message());
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
