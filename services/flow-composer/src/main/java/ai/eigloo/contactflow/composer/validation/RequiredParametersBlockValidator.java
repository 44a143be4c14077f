package ai.eigloo.contactflow.composer.validation;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.validation.BlockValidator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that blocks carry the parameters configured for their type.
 * Types without an entry are accepted as-is.
 */
public class RequiredParametersBlockValidator implements BlockValidator {

    public static final String MISSING_PARAMETER = "MISSING_PARAMETER";
    public static final String EMPTY_PARAMETER = "EMPTY_PARAMETER";

    private final Map<String, List<String>> requiredParameters;

    public RequiredParametersBlockValidator(Map<String, List<String>> requiredParameters) {
        this.requiredParameters = new LinkedHashMap<>();
        requiredParameters.forEach((type, keys) -> this.requiredParameters.put(type, List.copyOf(keys)));
    }

    @Override
    public List<Diagnostic> validate(String nodeId, String type, Map<String, JsonNode> parameters) {
        List<String> required = requiredParameters.get(type);
        if (required == null) {
            return List.of();
        }
        List<Diagnostic> findings = new ArrayList<>();
        for (String key : required) {
            JsonNode value = parameters.get(key);
            if (value == null || value.isNull()) {
                findings.add(Diagnostic.error(MISSING_PARAMETER, nodeId,
                        type + " block requires parameter '" + key + "'"));
            } else if (value.isTextual() && value.asText().isBlank()) {
                findings.add(Diagnostic.warning(EMPTY_PARAMETER, nodeId,
                        "Parameter '" + key + "' of " + type + " block is blank"));
            }
        }
        return findings;
    }
}
