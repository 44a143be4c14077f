package ai.eigloo.contactflow.graph.exception;

import java.util.List;

/**
 * Thrown when a block validator rejects a node's type or parameters.
 */
public class InvalidBlockException extends FlowGraphException {

    private final List<String> problems;

    public InvalidBlockException(String nodeId, List<String> problems) {
        super(FlowErrorCode.INVALID_BLOCK, nodeId,
                "Node '" + nodeId + "' failed block validation: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
