package ai.eigloo.contactflow.composer.controller;

import ai.eigloo.contactflow.composer.dto.CompileResponse;
import ai.eigloo.contactflow.composer.dto.DecompileResponse;
import ai.eigloo.contactflow.composer.dto.FlowDefinitionDto;
import ai.eigloo.contactflow.composer.dto.ValidationResult;
import ai.eigloo.contactflow.composer.service.FlowCompilationService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for flow compilation.
 * Converts between flow definitions and the routing engine's wire documents.
 */
@RestController
@RequestMapping("/api/v1/flows")
@CrossOrigin(origins = "*", maxAge = 3600)
public class FlowController {

    private final FlowCompilationService flowCompilationService;

    public FlowController(FlowCompilationService flowCompilationService) {
        this.flowCompilationService = flowCompilationService;
    }

    /**
     * Compile a flow definition into a wire document.
     *
     * @param definition the flow to compile
     * @return the document with any warnings
     */
    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody FlowDefinitionDto definition) {
        return ResponseEntity.ok(flowCompilationService.compile(definition));
    }

    /**
     * Compile a flow definition and return the bare wire document, ready to
     * hand to the routing engine.
     */
    @PostMapping(value = "/compile/document", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> compileDocument(@Valid @RequestBody FlowDefinitionDto definition) {
        return ResponseEntity.ok(flowCompilationService.compileDocument(definition));
    }

    /**
     * Decompile a wire document into a flow definition.
     *
     * @param document the wire document
     * @return the flow definition and the builder source that recreates it
     */
    @PostMapping("/decompile")
    public ResponseEntity<DecompileResponse> decompile(@RequestBody JsonNode document) {
        return ResponseEntity.ok(flowCompilationService.decompile(document));
    }

    /**
     * Validate a flow definition. Always answers 200; problems are listed in the body.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody FlowDefinitionDto definition) {
        return ResponseEntity.ok(flowCompilationService.validate(definition));
    }
}
