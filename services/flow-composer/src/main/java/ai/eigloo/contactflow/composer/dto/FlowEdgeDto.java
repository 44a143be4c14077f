package ai.eigloo.contactflow.composer.dto;

import ai.eigloo.contactflow.graph.model.EdgeKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Directed transition between two blocks. {@code label} carries the match
 * value of a CONDITION edge or the error code of an ERROR edge.
 */
public class FlowEdgeDto {

    @NotBlank(message = "Edge 'from' node cannot be blank")
    private String from;

    @NotNull(message = "Edge 'kind' cannot be null")
    private EdgeKind kind;

    private String label;

    @NotBlank(message = "Edge 'to' node cannot be blank")
    private String to;

    public FlowEdgeDto() {
    }

    public FlowEdgeDto(String from, EdgeKind kind, String label, String to) {
        this.from = from;
        this.kind = kind;
        this.label = label;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public void setKind(EdgeKind kind) {
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }
}
