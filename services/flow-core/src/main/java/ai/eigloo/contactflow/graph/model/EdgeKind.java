package ai.eigloo.contactflow.graph.model;

/**
 * Kinds of transition between two flow nodes.
 *
 * <p>Declaration order is the canonical order in which a node's outgoing
 * transitions are traversed and serialized.</p>
 */
public enum EdgeKind {
    /** Unconditional next step. At most one per node. */
    SEQUENTIAL,
    /** Taken when the node result equals the edge's match value. */
    CONDITION,
    /** Taken when no condition matched. At most one per node. */
    DEFAULT,
    /** Taken when the node fails with the edge's error code. */
    ERROR;

    public boolean isLabeled() {
        return this == CONDITION || this == ERROR;
    }

    public boolean isSingular() {
        return !isLabeled();
    }
}
