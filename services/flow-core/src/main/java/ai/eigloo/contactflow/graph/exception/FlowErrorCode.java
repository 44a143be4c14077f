package ai.eigloo.contactflow.graph.exception;

/**
 * Stable identifiers for every structural error the flow core can raise.
 */
public enum FlowErrorCode {
    DUPLICATE_NODE_ID,
    DUPLICATE_EDGE_KIND,
    DUPLICATE_CONDITION_VALUE,
    DUPLICATE_ERROR_CODE,
    RESERVED_TRANSITION_KEY,
    UNRESOLVED_REFERENCE,
    MISSING_ENTRY_NODE,
    INVALID_BLOCK,
    MALFORMED_DOCUMENT,
    UNKNOWN_TRANSITION_KEY,
    DANGLING_TRANSITION
}
