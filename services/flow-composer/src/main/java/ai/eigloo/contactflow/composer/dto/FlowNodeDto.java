package ai.eigloo.contactflow.composer.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One block of a flow definition.
 */
public class FlowNodeDto {

    @NotBlank(message = "Node id cannot be blank")
    private String id;

    @NotBlank(message = "Node type cannot be blank")
    private String type;

    private Map<String, JsonNode> parameters = new LinkedHashMap<>();

    private Map<String, JsonNode> extraFields = new LinkedHashMap<>();

    public FlowNodeDto() {
    }

    public FlowNodeDto(String id, String type, Map<String, JsonNode> parameters) {
        this.id = id;
        this.type = type;
        this.parameters = parameters;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, JsonNode> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, JsonNode> parameters) {
        this.parameters = parameters;
    }

    public Map<String, JsonNode> getExtraFields() {
        return extraFields;
    }

    public void setExtraFields(Map<String, JsonNode> extraFields) {
        this.extraFields = extraFields;
    }
}
