package ai.eigloo.contactflow.graph.compiler;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.layout.FlowLayout;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Wire document produced by {@link FlowCompiler} together with the layout it
 * embeds and any non-fatal diagnostics.
 */
public record CompilationResult(ObjectNode document, FlowLayout layout, List<Diagnostic> diagnostics) {

    public CompilationResult {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
        diagnostics = List.copyOf(diagnostics);
    }

    public String toJson() {
        return toJson(true);
    }

    public String toJson(boolean pretty) {
        return FlowJson.write(document, pretty);
    }

    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }
}
