package ai.eigloo.contactflow.composer.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire document produced for a flow definition, with layout warnings.
 */
public class CompileResponse {

    private JsonNode document;
    private List<DiagnosticDto> diagnostics = new ArrayList<>();

    public CompileResponse() {
    }

    public CompileResponse(JsonNode document, List<DiagnosticDto> diagnostics) {
        this.document = document;
        this.diagnostics = diagnostics;
    }

    public JsonNode getDocument() {
        return document;
    }

    public void setDocument(JsonNode document) {
        this.document = document;
    }

    public List<DiagnosticDto> getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(List<DiagnosticDto> diagnostics) {
        this.diagnostics = diagnostics;
    }
}
