package ai.eigloo.contactflow.graph.diagnostic;

/**
 * Non-fatal finding reported next to a successful layout or compile.
 *
 * @param severity how serious the finding is
 * @param code stable machine-readable code, e.g. {@code ORPHAN_NODE}
 * @param nodeId node the finding concerns, or {@code null}
 * @param message human-readable description
 */
public record Diagnostic(Severity severity, String code, String nodeId, String message) {

    public static final String ORPHAN_NODE = "ORPHAN_NODE";

    public Diagnostic {
        if (severity == null) {
            throw new IllegalArgumentException("Diagnostic severity cannot be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Diagnostic code cannot be null or empty");
        }
    }

    public static Diagnostic warning(String code, String nodeId, String message) {
        return new Diagnostic(Severity.WARNING, code, nodeId, message);
    }

    public static Diagnostic error(String code, String nodeId, String message) {
        return new Diagnostic(Severity.ERROR, code, nodeId, message);
    }

    public static Diagnostic orphan(String nodeId) {
        return warning(ORPHAN_NODE, nodeId, "Node '" + nodeId + "' is not reachable from the entry node");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
