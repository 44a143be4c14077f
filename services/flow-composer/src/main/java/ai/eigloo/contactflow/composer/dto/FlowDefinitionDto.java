package ai.eigloo.contactflow.composer.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data Transfer Object for a complete flow definition.
 * Nodes and edges are id-keyed; edge targets are resolved when the flow is compiled.
 */
public class FlowDefinitionDto {

    @Size(max = 255, message = "Flow name cannot exceed 255 characters")
    private String name;

    private String description;

    private String version;

    private String startNodeId;

    @NotNull(message = "Nodes cannot be null")
    @Valid
    private List<FlowNodeDto> nodes = new ArrayList<>();

    @NotNull(message = "Edges cannot be null")
    @Valid
    private List<FlowEdgeDto> edges = new ArrayList<>();

    private Map<String, JsonNode> extensions = new LinkedHashMap<>();

    public FlowDefinitionDto() {
    }

    public FlowDefinitionDto(String name, String startNodeId, List<FlowNodeDto> nodes, List<FlowEdgeDto> edges) {
        this.name = name;
        this.startNodeId = startNodeId;
        this.nodes = nodes;
        this.edges = edges;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public void setStartNodeId(String startNodeId) {
        this.startNodeId = startNodeId;
    }

    public List<FlowNodeDto> getNodes() {
        return nodes;
    }

    public void setNodes(List<FlowNodeDto> nodes) {
        this.nodes = nodes;
    }

    public List<FlowEdgeDto> getEdges() {
        return edges;
    }

    public void setEdges(List<FlowEdgeDto> edges) {
        this.edges = edges;
    }

    public Map<String, JsonNode> getExtensions() {
        return extensions;
    }

    public void setExtensions(Map<String, JsonNode> extensions) {
        this.extensions = extensions;
    }
}
