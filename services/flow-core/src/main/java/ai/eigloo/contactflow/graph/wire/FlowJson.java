package ai.eigloo.contactflow.graph.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson plumbing for parameter bags and wire documents.
 *
 * <p>Decimals are kept as exact {@code BigDecimal}s, scale included, and
 * repeated object keys are rejected instead of silently collapsed.</p>
 */
public final class FlowJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final ObjectMapper PRETTY_MAPPER = MAPPER.copy()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private FlowJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts an arbitrary parameter value into a JSON tree. Strings stay
     * strings, so template placeholders pass through untouched.
     */
    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        return MAPPER.valueToTree(value);
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String write(JsonNode node, boolean pretty) {
        try {
            return (pretty ? PRETTY_MAPPER : MAPPER).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow JSON", e);
        }
    }

    /**
     * Deep, insertion-ordered, unmodifiable copy of a JSON bag.
     */
    public static Map<String, JsonNode> frozenCopy(Map<String, JsonNode> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, value == null ? NullNode.getInstance() : value.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }
}
