package ai.eigloo.contactflow.graph.builder;

import ai.eigloo.contactflow.graph.exception.DuplicateNodeIdException;
import ai.eigloo.contactflow.graph.model.Block;
import ai.eigloo.contactflow.graph.model.EdgeKind;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.FlowNode;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import ai.eigloo.contactflow.graph.model.TransitionRules;
import ai.eigloo.contactflow.graph.wire.FlowJson;
import ai.eigloo.contactflow.graph.wire.WireFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Mutable, in-memory construction surface for one flow.
 *
 * <p>Convenience constructors create and register a block and return its
 * {@link NodeHandle}. Every connection verb ends in {@link #addEdge}, which
 * enforces the per-node transition rules immediately. Edge targets are only
 * resolved when the flow is compiled.</p>
 *
 * <p>Not thread-safe: use one builder per flow, or serialize access.</p>
 */
public class FlowBuilder {

    private final String name;
    private final Supplier<String> idGenerator;
    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> edgesBySource = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Map<String, JsonNode> extensions = new LinkedHashMap<>();
    private String description;
    private String version = WireFields.DEFAULT_VERSION;
    private String entryNodeId;

    public FlowBuilder(String name) {
        this(name, () -> UUID.randomUUID().toString());
    }

    /**
     * @param name flow name
     * @param idGenerator source of ids for blocks made by convenience constructors
     */
    public FlowBuilder(String name, Supplier<String> idGenerator) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("Id generator cannot be null");
        }
        this.name = name;
        this.idGenerator = idGenerator;
    }

    /**
     * Generates ids {@code prefix-1}, {@code prefix-2}, ... in creation order.
     */
    public static Supplier<String> sequentialIds(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return () -> prefix + "-" + counter.incrementAndGet();
    }

    public String getName() {
        return name;
    }

    public FlowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public FlowBuilder version(String version) {
        this.version = version;
        return this;
    }

    public FlowBuilder extension(String field, Object value) {
        if (WireFields.DOCUMENT_FIELDS.contains(field)) {
            throw new IllegalArgumentException("Field '" + field + "' is managed by the compiler");
        }
        extensions.put(field, FlowJson.toNode(value));
        return this;
    }

    // Block registration

    /**
     * Registers a pre-built node. Use this for block types without a
     * convenience constructor.
     *
     * @throws DuplicateNodeIdException if the id is already registered
     */
    public NodeHandle add(FlowNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Node cannot be null");
        }
        if (nodes.containsKey(node.id())) {
            throw new DuplicateNodeIdException(node.id());
        }
        nodes.put(node.id(), node);
        if (entryNodeId == null) {
            entryNodeId = node.id();
        }
        return new NodeHandle(this, node);
    }

    public NodeHandle add(String type) {
        return add(Block.of(idGenerator.get(), type));
    }

    public NodeHandle playPrompt(String text) {
        return add(newBlock(BlockTypes.MESSAGE_PARTICIPANT).parameter("Text", text));
    }

    public NodeHandle getInput(String text) {
        return getInput(text, 5);
    }

    public NodeHandle getInput(String text, int timeoutSeconds) {
        return add(newBlock(BlockTypes.GET_PARTICIPANT_INPUT)
                .parameter("Text", text)
                .parameter("InputTimeLimitSeconds", String.valueOf(timeoutSeconds))
                .parameter("StoreInput", "False"));
    }

    public NodeHandle disconnect() {
        return add(newBlock(BlockTypes.DISCONNECT_PARTICIPANT));
    }

    public NodeHandle transferToFlow(String contactFlowId) {
        return add(newBlock(BlockTypes.TRANSFER_TO_FLOW).parameter("ContactFlowId", contactFlowId));
    }

    public NodeHandle lexBot(String text, String lexV2BotAliasArn) {
        Block block = newBlock(BlockTypes.CONNECT_PARTICIPANT_WITH_LEX_BOT);
        if (text != null) {
            block.parameter("Text", text);
        }
        block.parameter("LexV2Bot", Map.of("AliasArn", lexV2BotAliasArn));
        return add(block);
    }

    public NodeHandle invokeLambda(String functionArn) {
        return invokeLambda(functionArn, 8);
    }

    public NodeHandle invokeLambda(String functionArn, int timeoutSeconds) {
        return add(newBlock(BlockTypes.INVOKE_LAMBDA_FUNCTION)
                .parameter("LambdaFunctionARN", functionArn)
                .parameter("InvocationTimeLimitSeconds", String.valueOf(timeoutSeconds)));
    }

    public NodeHandle checkHours() {
        return checkHours(null);
    }

    public NodeHandle checkHours(String hoursOfOperationId) {
        Block block = newBlock(BlockTypes.CHECK_HOURS_OF_OPERATION);
        if (hoursOfOperationId != null) {
            block.parameter("HoursOfOperationId", hoursOfOperationId);
        }
        return add(block);
    }

    public NodeHandle updateAttributes(Map<String, String> attributes) {
        return add(newBlock(BlockTypes.UPDATE_CONTACT_ATTRIBUTES)
                .parameter("Attributes", new LinkedHashMap<>(attributes)));
    }

    public NodeHandle updateTargetQueue(String queueId) {
        return add(newBlock(BlockTypes.UPDATE_CONTACT_TARGET_QUEUE).parameter("QueueId", queueId));
    }

    public NodeHandle showView(Object viewResource) {
        return add(newBlock(BlockTypes.SHOW_VIEW).parameter("ViewResource", viewResource));
    }

    public NodeHandle endFlow() {
        return add(newBlock(BlockTypes.END_FLOW_EXECUTION));
    }

    // Lookup and entry

    /**
     * Returns a handle for an already registered node.
     *
     * @throws IllegalArgumentException if no node has this id
     */
    public NodeHandle node(String id) {
        FlowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node with id '" + id + "' in flow");
        }
        return new NodeHandle(this, node);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public FlowBuilder entry(NodeHandle handle) {
        return entry(handle.id());
    }

    /**
     * Overrides the entry node. The id is checked when the flow is compiled.
     */
    public FlowBuilder entry(String nodeId) {
        this.entryNodeId = nodeId;
        return this;
    }

    public String getEntryNodeId() {
        return entryNodeId;
    }

    // Edges

    /**
     * Adds one transition. All connection verbs delegate here.
     *
     * @param from source node id
     * @param kind transition kind
     * @param label match value or error code, {@code null} for unlabeled kinds
     * @param to target node id, possibly not yet registered
     */
    public FlowBuilder addEdge(String from, EdgeKind kind, String label, String to) {
        GraphEdge edge = new GraphEdge(from, kind, label, to);
        List<GraphEdge> siblings = edgesBySource.computeIfAbsent(from, k -> new ArrayList<>());
        TransitionRules.checkAddable(siblings, edge);
        siblings.add(edge);
        edges.add(edge);
        return this;
    }

    public List<GraphEdge> getEdges() {
        return List.copyOf(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Takes an immutable snapshot of the flow. Later builder changes do not
     * affect the returned graph.
     */
    public FlowGraph build() {
        List<GraphNode> snapshot = new ArrayList<>(nodes.size());
        for (FlowNode node : nodes.values()) {
            snapshot.add(GraphNode.copyOf(node));
        }
        return new FlowGraph(name, description, version, entryNodeId, snapshot, edges, extensions);
    }

    Block block(String id) {
        FlowNode node = nodes.get(id);
        if (!(node instanceof Block block)) {
            throw new UnsupportedOperationException("Node '" + id + "' is not a mutable block");
        }
        return block;
    }

    private Block newBlock(String type) {
        return Block.of(idGenerator.get(), type);
    }
}
