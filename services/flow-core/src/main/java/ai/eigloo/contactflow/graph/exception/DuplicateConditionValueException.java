package ai.eigloo.contactflow.graph.exception;

/**
 * Thrown when two CONDITION edges from one node share a match value.
 */
public class DuplicateConditionValueException extends FlowGraphException {

    private final String matchValue;

    public DuplicateConditionValueException(String nodeId, String matchValue) {
        super(FlowErrorCode.DUPLICATE_CONDITION_VALUE, nodeId,
                "Node '" + nodeId + "' already has a condition for value '" + matchValue + "'");
        this.matchValue = matchValue;
    }

    public String getMatchValue() {
        return matchValue;
    }
}
