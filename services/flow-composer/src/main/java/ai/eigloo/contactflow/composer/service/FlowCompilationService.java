package ai.eigloo.contactflow.composer.service;

import ai.eigloo.contactflow.composer.dto.CompileResponse;
import ai.eigloo.contactflow.composer.dto.DecompileResponse;
import ai.eigloo.contactflow.composer.dto.FlowDefinitionDto;
import ai.eigloo.contactflow.composer.dto.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Service interface for turning flow definitions into wire documents and back.
 */
public interface FlowCompilationService {

    /**
     * Compile a flow definition.
     *
     * @param definition the flow to compile
     * @return the wire document and any layout or block warnings
     * @throws ai.eigloo.contactflow.graph.exception.FlowGraphException if the flow cannot be compiled
     */
    CompileResponse compile(FlowDefinitionDto definition);

    /**
     * Compile a flow definition and render the wire document as text,
     * indented when {@code contactflow.compiler.pretty-print} is set.
     *
     * @param definition the flow to compile
     * @return the wire document
     */
    String compileDocument(FlowDefinitionDto definition);

    /**
     * Recover a flow definition from a wire document.
     *
     * @param document wire document from any producer
     * @return the flow definition and equivalent builder source
     * @throws ai.eigloo.contactflow.graph.exception.FlowGraphException if the document cannot be mapped
     */
    DecompileResponse decompile(JsonNode document);

    /**
     * Check a flow definition without failing on the first problem's exception.
     *
     * @param definition the flow to check
     * @return validation result with any errors or warnings
     */
    ValidationResult validate(FlowDefinitionDto definition);
}
