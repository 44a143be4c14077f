package ai.eigloo.contactflow.graph.diagnostic;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
