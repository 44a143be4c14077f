package ai.eigloo.contactflow.graph.model;

import ai.eigloo.contactflow.graph.exception.DuplicateConditionValueException;
import ai.eigloo.contactflow.graph.exception.DuplicateEdgeKindException;
import ai.eigloo.contactflow.graph.exception.DuplicateErrorCodeException;
import ai.eigloo.contactflow.graph.exception.ReservedTransitionKeyException;
import ai.eigloo.contactflow.graph.wire.WireFields;

import java.util.Collection;

/**
 * Per-node uniqueness rules for outgoing transitions.
 */
public final class TransitionRules {

    private TransitionRules() {
    }

    /**
     * Checks that {@code candidate} may be added next to {@code existing}.
     *
     * @param existing edges already leaving the candidate's source node; others are ignored
     * @param candidate the edge about to be added
     */
    public static void checkAddable(Collection<GraphEdge> existing, GraphEdge candidate) {
        if (candidate.kind() == EdgeKind.CONDITION
                && WireFields.RESERVED_TRANSITION_KEYS.contains(candidate.label())) {
            throw new ReservedTransitionKeyException(candidate.from(), candidate.label());
        }
        for (GraphEdge edge : existing) {
            if (!edge.from().equals(candidate.from()) || edge.kind() != candidate.kind()) {
                continue;
            }
            switch (candidate.kind()) {
                case SEQUENTIAL, DEFAULT ->
                        throw new DuplicateEdgeKindException(candidate.from(), candidate.kind(), edge.to());
                case CONDITION -> {
                    if (edge.label().equals(candidate.label())) {
                        throw new DuplicateConditionValueException(candidate.from(), candidate.label());
                    }
                }
                case ERROR -> {
                    if (edge.label().equals(candidate.label())) {
                        throw new DuplicateErrorCodeException(candidate.from(), candidate.label());
                    }
                }
            }
        }
    }
}
