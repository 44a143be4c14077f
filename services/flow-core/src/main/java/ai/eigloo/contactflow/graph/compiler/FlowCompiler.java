package ai.eigloo.contactflow.graph.compiler;

import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.exception.InvalidBlockException;
import ai.eigloo.contactflow.graph.exception.MissingEntryNodeException;
import ai.eigloo.contactflow.graph.exception.UnresolvedReferenceException;
import ai.eigloo.contactflow.graph.layout.FlowLayout;
import ai.eigloo.contactflow.graph.layout.LayoutEngine;
import ai.eigloo.contactflow.graph.layout.Position;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import ai.eigloo.contactflow.graph.validation.BlockValidator;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link FlowGraph} into the routing engine's wire document.
 *
 * <p>Compilation is pure: the same graph, built in the same order, always
 * yields byte-identical JSON. Parameter values, template placeholders
 * included, are copied verbatim.</p>
 */
public class FlowCompiler {

    private static final Logger logger = LoggerFactory.getLogger(FlowCompiler.class);

    private final LayoutEngine layoutEngine;
    private final BlockValidator blockValidator;

    public FlowCompiler() {
        this(new LayoutEngine(), BlockValidator.NONE);
    }

    public FlowCompiler(LayoutEngine layoutEngine, BlockValidator blockValidator) {
        if (layoutEngine == null) {
            throw new IllegalArgumentException("Layout engine cannot be null");
        }
        this.layoutEngine = layoutEngine;
        this.blockValidator = blockValidator != null ? blockValidator : BlockValidator.NONE;
    }

    /**
     * Compiles a flow snapshot.
     *
     * @throws MissingEntryNodeException if the entry node is unset or absent
     * @throws UnresolvedReferenceException if an edge endpoint is not a node of the graph
     * @throws InvalidBlockException if the block validator reports an error
     */
    public CompilationResult compile(FlowGraph graph) {
        logger.debug("Compiling flow '{}' ({} nodes, {} edges)", graph.name(), graph.nodeCount(), graph.edgeCount());

        Map<String, GraphNode> index = graph.nodeIndex();
        if (graph.entryNodeId() == null || !index.containsKey(graph.entryNodeId())) {
            throw new MissingEntryNodeException(graph.entryNodeId());
        }
        for (GraphEdge edge : graph.edges()) {
            if (!index.containsKey(edge.from())) {
                throw new UnresolvedReferenceException(edge.from(), edge.from());
            }
            if (!index.containsKey(edge.to())) {
                throw new UnresolvedReferenceException(edge.from(), edge.to());
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>(validateBlocks(graph));
        FlowLayout layout = layoutEngine.layout(graph);
        diagnostics.addAll(layout.diagnostics());
        for (String orphan : layout.orphanNodeIds()) {
            logger.warn("Flow '{}': node '{}' ({}) is unreachable from entry node '{}'",
                    graph.name(), orphan, index.get(orphan).type(), graph.entryNodeId());
        }

        ObjectNode document = buildDocument(graph, layout);
        return new CompilationResult(document, layout, diagnostics);
    }

    /**
     * Compiles and renders indented JSON.
     */
    public String compileToJson(FlowGraph graph) {
        return compile(graph).toJson(true);
    }

    private List<Diagnostic> validateBlocks(FlowGraph graph) {
        List<Diagnostic> reported = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            List<Diagnostic> findings = blockValidator.validate(node.id(), node.type(), node.parameters());
            List<String> errors = new ArrayList<>();
            for (Diagnostic finding : findings) {
                if (finding.isError()) {
                    errors.add(finding.message());
                } else {
                    reported.add(finding);
                }
            }
            if (!errors.isEmpty()) {
                throw new InvalidBlockException(node.id(), errors);
            }
        }
        return reported;
    }

    private ObjectNode buildDocument(FlowGraph graph, FlowLayout layout) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode document = factory.objectNode();
        document.put(WireFields.VERSION, graph.version());
        if (graph.name() != null) {
            document.put(WireFields.NAME, graph.name());
        }
        if (graph.description() != null) {
            document.put(WireFields.DESCRIPTION, graph.description());
        }
        document.put(WireFields.START_ACTION, graph.entryNodeId());

        ObjectNode metadata = document.putObject(WireFields.METADATA);
        metadata.set(WireFields.ENTRY_POINT_POSITION, position(new Position(0, 0)));
        metadata.put(WireFields.SNAP_TO_GRID, false);

        ArrayNode actions = document.putArray(WireFields.ACTIONS);
        Map<String, List<GraphEdge>> outgoing = graph.outgoingBySource();
        for (GraphNode node : graph.nodes()) {
            actions.add(buildRecord(node, layout.positionOf(node.id()), outgoing.getOrDefault(node.id(), List.of())));
        }

        graph.extensions().forEach(document::set);
        return document;
    }

    private ObjectNode buildRecord(GraphNode node, Position position, List<GraphEdge> edges) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        record.put(WireFields.IDENTIFIER, node.id());
        record.put(WireFields.TYPE, node.type());

        ObjectNode parameters = record.putObject(WireFields.PARAMETERS);
        node.parameters().forEach(parameters::set);

        record.putObject(WireFields.METADATA).set(WireFields.POSITION, position(position));

        ObjectNode transitions = record.putObject(WireFields.TRANSITIONS);
        ObjectNode errors = JsonNodeFactory.instance.objectNode();
        for (GraphEdge edge : edges) {
            switch (edge.kind()) {
                case SEQUENTIAL -> transitions.put(WireFields.SUCCESS, edge.to());
                case CONDITION -> transitions.put(edge.label(), edge.to());
                case DEFAULT -> transitions.put(WireFields.DEFAULT, edge.to());
                case ERROR -> errors.put(edge.label(), edge.to());
            }
        }
        if (!errors.isEmpty()) {
            transitions.set(WireFields.ERRORS, errors);
        }

        node.extraFields().forEach(record::set);
        return record;
    }

    private static JsonNode position(Position position) {
        ObjectNode node = FlowJson.mapper().createObjectNode();
        node.put(WireFields.X, position.x());
        node.put(WireFields.Y, position.y());
        return node;
    }
}
