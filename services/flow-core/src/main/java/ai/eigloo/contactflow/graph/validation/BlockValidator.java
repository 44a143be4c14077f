package ai.eigloo.contactflow.graph.validation;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Pluggable per-block-type check supplied by a block catalog.
 *
 * <p>The core treats parameters as an open bag; a validator decides which
 * keys a type requires or forbids. ERROR diagnostics abort compilation,
 * anything else is reported with the result.</p>
 */
@FunctionalInterface
public interface BlockValidator {

    /** Accepts every block. */
    BlockValidator NONE = (nodeId, type, parameters) -> List.of();

    List<Diagnostic> validate(String nodeId, String type, Map<String, JsonNode> parameters);
}
