package ai.eigloo.contactflow.composer.dto;

/**
 * Flow definition recovered from a wire document, plus the builder calls
 * that recreate it.
 */
public class DecompileResponse {

    private FlowDefinitionDto flow;
    private String builderSource;

    public DecompileResponse() {
    }

    public DecompileResponse(FlowDefinitionDto flow, String builderSource) {
        this.flow = flow;
        this.builderSource = builderSource;
    }

    public FlowDefinitionDto getFlow() {
        return flow;
    }

    public void setFlow(FlowDefinitionDto flow) {
        this.flow = flow;
    }

    public String getBuilderSource() {
        return builderSource;
    }

    public void setBuilderSource(String builderSource) {
        this.builderSource = builderSource;
    }
}
