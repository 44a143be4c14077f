package ai.eigloo.contactflow.graph.builder;

import ai.eigloo.contactflow.graph.model.EdgeKind;
import ai.eigloo.contactflow.graph.model.FlowNode;

/**
 * Reference to a node registered with a {@link FlowBuilder}.
 *
 * <p>Connection verbs add an edge from this node and return the same handle,
 * so branches can be chained:</p>
 * <pre>{@code
 * menu.when("1", sales).when("2", support).otherwise(retry);
 * }</pre>
 * Targets can be handles or raw ids; raw ids may name nodes that do not exist
 * yet and are resolved at compile time.
 */
public final class NodeHandle {

    private final FlowBuilder builder;
    private final FlowNode node;

    NodeHandle(FlowBuilder builder, FlowNode node) {
        this.builder = builder;
        this.node = node;
    }

    public String id() {
        return node.id();
    }

    public String type() {
        return node.type();
    }

    public FlowNode node() {
        return node;
    }

    public NodeHandle then(NodeHandle target) {
        return then(target.id());
    }

    public NodeHandle then(String targetId) {
        builder.addEdge(id(), EdgeKind.SEQUENTIAL, null, targetId);
        return this;
    }

    public NodeHandle when(String matchValue, NodeHandle target) {
        return when(matchValue, target.id());
    }

    public NodeHandle when(String matchValue, String targetId) {
        builder.addEdge(id(), EdgeKind.CONDITION, matchValue, targetId);
        return this;
    }

    public NodeHandle otherwise(NodeHandle target) {
        return otherwise(target.id());
    }

    public NodeHandle otherwise(String targetId) {
        builder.addEdge(id(), EdgeKind.DEFAULT, null, targetId);
        return this;
    }

    public NodeHandle onError(String errorCode, NodeHandle target) {
        return onError(errorCode, target.id());
    }

    public NodeHandle onError(String errorCode, String targetId) {
        builder.addEdge(id(), EdgeKind.ERROR, errorCode, targetId);
        return this;
    }

    /**
     * Updates a parameter on the underlying node. Only supported for nodes
     * created as {@link ai.eigloo.contactflow.graph.model.Block}s.
     */
    public NodeHandle parameter(String key, Object value) {
        builder.block(id()).parameter(key, value);
        return this;
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
