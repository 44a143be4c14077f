package ai.eigloo.contactflow.graph.decompiler;

import ai.eigloo.contactflow.graph.builder.FlowBuilder;
import ai.eigloo.contactflow.graph.exception.DanglingTransitionException;
import ai.eigloo.contactflow.graph.exception.MalformedDocumentException;
import ai.eigloo.contactflow.graph.exception.MissingEntryNodeException;
import ai.eigloo.contactflow.graph.exception.UnknownTransitionKeyException;
import ai.eigloo.contactflow.graph.model.EdgeKind;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphNode;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parses a wire document back into a {@link FlowGraph}.
 *
 * <p>Accepts documents from any producer. Node coordinates and top-level
 * canvas metadata are dropped; every other field the schema does not name is
 * kept opaquely, so decompiling and recompiling loses nothing but layout.</p>
 */
public class FlowDecompiler {

    private static final Logger logger = LoggerFactory.getLogger(FlowDecompiler.class);

    /**
     * @throws MalformedDocumentException if the text is not JSON or a required field is absent or ill-typed
     */
    public FlowGraph decompile(String json) {
        JsonNode document;
        try {
            document = FlowJson.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedDocumentException("", "Document is not valid JSON: " + e.getOriginalMessage());
        }
        return decompile(document);
    }

    /**
     * @throws MalformedDocumentException if a required field is absent or ill-typed
     * @throws UnknownTransitionKeyException if a transition cannot be mapped to an edge kind
     * @throws DanglingTransitionException if a transition targets an id with no node-record
     * @throws MissingEntryNodeException if {@code StartAction} names no node-record
     */
    public FlowGraph decompile(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new MalformedDocumentException("", "Document must be a JSON object");
        }
        String startAction = requiredText(document, WireFields.START_ACTION);
        JsonNode actions = document.get(WireFields.ACTIONS);
        if (actions == null || !actions.isArray()) {
            throw new MalformedDocumentException("/" + WireFields.ACTIONS, "Missing required array '" + WireFields.ACTIONS + "'");
        }

        FlowBuilder builder = new FlowBuilder(optionalText(document, WireFields.NAME))
                .description(optionalText(document, WireFields.DESCRIPTION))
                .version(optionalText(document, WireFields.VERSION));
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!WireFields.DOCUMENT_FIELDS.contains(field.getKey())) {
                builder.extension(field.getKey(), field.getValue());
            }
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < actions.size(); i++) {
            GraphNode node = readNode(actions.get(i), "/" + WireFields.ACTIONS + "/" + i);
            builder.add(node);
            ids.add(node.id());
        }

        for (int i = 0; i < actions.size(); i++) {
            readTransitions(builder, actions.get(i), ids, "/" + WireFields.ACTIONS + "/" + i);
        }

        if (!ids.contains(startAction)) {
            throw new MissingEntryNodeException(startAction);
        }
        builder.entry(startAction);

        FlowGraph graph = builder.build();
        logger.debug("Decompiled flow '{}' with {} nodes and {} edges", graph.name(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Reads a record straight into a snapshot node. Parameter and field keys
     * are copied as found, so keys the builder API would refuse survive the
     * round trip.
     */
    private GraphNode readNode(JsonNode record, String pointer) {
        if (record == null || !record.isObject()) {
            throw new MalformedDocumentException(pointer, "Node-record must be a JSON object");
        }
        String id = requiredText(record, WireFields.IDENTIFIER, pointer);
        String type = requiredText(record, WireFields.TYPE, pointer);
        if (id.isBlank() || type.isBlank()) {
            throw new MalformedDocumentException(pointer, "Identifier and Type cannot be blank");
        }

        Map<String, JsonNode> parameters = new LinkedHashMap<>();
        JsonNode parametersNode = record.get(WireFields.PARAMETERS);
        if (parametersNode != null && !parametersNode.isNull()) {
            if (!parametersNode.isObject()) {
                throw new MalformedDocumentException(id, pointer + "/" + WireFields.PARAMETERS, "Parameters must be a JSON object");
            }
            parametersNode.fields().forEachRemaining(entry -> parameters.put(entry.getKey(), entry.getValue()));
        }

        Map<String, JsonNode> extraFields = new LinkedHashMap<>();
        record.fields().forEachRemaining(entry -> {
            if (!WireFields.RECORD_FIELDS.contains(entry.getKey())) {
                extraFields.put(entry.getKey(), entry.getValue());
            }
        });
        return new GraphNode(id, type, parameters, extraFields);
    }

    private void readTransitions(FlowBuilder builder, JsonNode record, Set<String> ids, String pointer) {
        String id = record.get(WireFields.IDENTIFIER).asText();
        JsonNode transitions = record.get(WireFields.TRANSITIONS);
        if (transitions == null || transitions.isNull()) {
            return;
        }
        String transitionsPointer = pointer + "/" + WireFields.TRANSITIONS;
        if (!transitions.isObject()) {
            throw new MalformedDocumentException(id, transitionsPointer, "Transitions must be a JSON object");
        }

        Iterator<Map.Entry<String, JsonNode>> entries = transitions.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            switch (key) {
                case WireFields.SUCCESS -> builder.addEdge(id, EdgeKind.SEQUENTIAL, null,
                        target(id, key, value, ids, transitionsPointer));
                case WireFields.DEFAULT -> builder.addEdge(id, EdgeKind.DEFAULT, null,
                        target(id, key, value, ids, transitionsPointer));
                case WireFields.ERRORS -> readErrors(builder, id, value, ids, transitionsPointer + "/" + key);
                default -> {
                    if (key.isEmpty()) {
                        throw new UnknownTransitionKeyException(id, key, "empty key");
                    }
                    if (!value.isTextual()) {
                        throw new UnknownTransitionKeyException(id, key, "value is not a node id");
                    }
                    builder.addEdge(id, EdgeKind.CONDITION, key, target(id, key, value, ids, transitionsPointer));
                }
            }
        }
    }

    private void readErrors(FlowBuilder builder, String id, JsonNode errors, Set<String> ids, String pointer) {
        if (!errors.isObject()) {
            throw new MalformedDocumentException(id, pointer, "Errors must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = errors.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getKey().isEmpty()) {
                throw new UnknownTransitionKeyException(id, WireFields.ERRORS + "/", "empty error code");
            }
            String target = target(id, WireFields.ERRORS + "/" + entry.getKey(), entry.getValue(), ids, pointer);
            builder.addEdge(id, EdgeKind.ERROR, entry.getKey(), target);
        }
    }

    private static String target(String id, String key, JsonNode value, Set<String> ids, String pointer) {
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new MalformedDocumentException(id, pointer + "/" + key, "Transition target must be a node id");
        }
        String target = value.asText();
        if (!ids.contains(target)) {
            throw new DanglingTransitionException(id, key, target);
        }
        return target;
    }

    private static String requiredText(JsonNode node, String field) {
        return requiredText(node, field, "");
    }

    private static String requiredText(JsonNode node, String field, String pointer) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedDocumentException(pointer + "/" + field, "Missing required string '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedDocumentException("/" + field, "'" + field + "' must be a string");
        }
        return value.asText();
    }
}
