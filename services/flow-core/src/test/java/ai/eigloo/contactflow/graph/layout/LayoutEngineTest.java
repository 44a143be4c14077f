package ai.eigloo.contactflow.graph.layout;

import ai.eigloo.contactflow.graph.builder.FlowBuilder;
import ai.eigloo.contactflow.graph.builder.NodeHandle;
import ai.eigloo.contactflow.graph.diagnostic.Diagnostic;
import ai.eigloo.contactflow.graph.diagnostic.Severity;
import ai.eigloo.contactflow.graph.exception.MissingEntryNodeException;
import ai.eigloo.contactflow.graph.model.Block;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class LayoutEngineTest {

    private final LayoutEngine engine = new LayoutEngine();

    @Test
    void linearChainAdvancesOneColumnPerStep() {
        FlowBuilder flow = new FlowBuilder("Linear");
        NodeHandle a = flow.add(Block.of("a", "MessageParticipant"));
        NodeHandle b = flow.add(Block.of("b", "MessageParticipant"));
        NodeHandle c = flow.add(Block.of("c", "DisconnectParticipant"));
        a.then(b);
        b.then(c);

        FlowLayout layout = engine.layout(flow.build());

        assertThat(layout.positionOf("a")).isEqualTo(new Position(150, 50));
        assertThat(layout.positionOf("b")).isEqualTo(new Position(430, 50));
        assertThat(layout.positionOf("c")).isEqualTo(new Position(710, 50));
        assertThat(layout.diagnostics()).isEmpty();
    }

    @Test
    void branchesStackWithinColumnInCanonicalOrder() {
        // Given: edges added out of canonical order
        FlowBuilder flow = new FlowBuilder("Branches");
        NodeHandle menu = flow.add(Block.of("menu", "GetParticipantInput"));
        NodeHandle onError = flow.add(Block.of("err", "MessageParticipant"));
        NodeHandle fallback = flow.add(Block.of("fallback", "MessageParticipant"));
        NodeHandle one = flow.add(Block.of("one", "MessageParticipant"));
        NodeHandle two = flow.add(Block.of("two", "MessageParticipant"));
        menu.onError("NoMatchingError", onError)
                .otherwise(fallback)
                .when("1", one)
                .when("2", two);

        // When
        FlowLayout layout = engine.layout(flow.build());

        // Then
        assertThat(layout.rankOf("one")).isEqualTo(1);
        assertThat(layout.positionOf("one")).isEqualTo(new Position(430, 50));
        assertThat(layout.positionOf("two")).isEqualTo(new Position(430, 230));
        assertThat(layout.positionOf("fallback")).isEqualTo(new Position(430, 410));
        assertThat(layout.positionOf("err")).isEqualTo(new Position(430, 590));
    }

    @Test
    void rankIsShortestDistanceFromEntry() {
        // a -> b -> c and a -> c via a condition: c must land in column 1
        GraphNode a = node("a");
        GraphNode b = node("b");
        GraphNode c = node("c");
        FlowGraph graph = new FlowGraph("Shortcut", "a", List.of(a, b, c), List.of(
                GraphEdge.sequential("a", "b"),
                GraphEdge.condition("a", "skip", "c"),
                GraphEdge.sequential("b", "c")));

        FlowLayout layout = engine.layout(graph);

        assertThat(layout.rankOf("b")).isEqualTo(1);
        assertThat(layout.rankOf("c")).isEqualTo(1);
        assertThat(layout.positionOf("c")).isEqualTo(new Position(430, 230));
    }

    @Test
    void cyclesTerminate() {
        FlowGraph graph = new FlowGraph("Loop", "menu", List.of(node("menu"), node("retry")), List.of(
                GraphEdge.otherwise("menu", "retry"),
                GraphEdge.sequential("retry", "menu")));

        FlowLayout layout = engine.layout(graph);

        assertThat(layout.rankOf("menu")).isZero();
        assertThat(layout.rankOf("retry")).isEqualTo(1);
        assertThat(layout.positions()).hasSize(2);
    }

    @Test
    void selfLoopDoesNotMoveEntry() {
        FlowGraph graph = new FlowGraph("Self", "menu", List.of(node("menu")), List.of(
                GraphEdge.otherwise("menu", "menu")));

        assertThat(engine.layout(graph).positionOf("menu")).isEqualTo(new Position(150, 50));
    }

    @Test
    void orphansGoToTrailingColumnWithWarnings() {
        FlowGraph graph = new FlowGraph("Orphans", "a",
                List.of(node("x"), node("a"), node("b"), node("y")),
                List.of(GraphEdge.sequential("a", "b"), GraphEdge.sequential("x", "y")));

        FlowLayout layout = engine.layout(graph);

        assertThat(layout.orphanNodeIds()).containsExactly("x", "y");
        assertThat(layout.isOrphan("a")).isFalse();
        assertThat(layout.positionOf("x")).isEqualTo(new Position(710, 50));
        assertThat(layout.positionOf("y")).isEqualTo(new Position(710, 230));
        assertThat(layout.rankOf("y")).isEqualTo(2);
        assertThat(layout.diagnostics())
                .extracting(Diagnostic::severity, Diagnostic::code, Diagnostic::nodeId)
                .containsExactly(
                        tuple(Severity.WARNING, Diagnostic.ORPHAN_NODE, "x"),
                        tuple(Severity.WARNING, Diagnostic.ORPHAN_NODE, "y"));
    }

    @Test
    void layoutIsDeterministic() {
        FlowGraph graph = new FlowGraph("Twice", "a",
                List.of(node("a"), node("b"), node("c"), node("d")),
                List.of(
                        GraphEdge.condition("a", "1", "c"),
                        GraphEdge.condition("a", "2", "b"),
                        GraphEdge.sequential("c", "d")));

        FlowLayout first = engine.layout(graph);
        FlowLayout second = engine.layout(graph);

        assertThat(first).isEqualTo(second);
        assertThat(List.copyOf(first.positions().keySet())).containsExactly("a", "c", "b", "d");
    }

    @Test
    void emptyGraphYieldsEmptyLayout() {
        FlowLayout layout = engine.layout(new FlowGraph("Empty", null, List.of(), List.of()));

        assertThat(layout.positions()).isEmpty();
        assertThat(layout.diagnostics()).isEmpty();
    }

    @Test
    void missingEntryRejected() {
        FlowGraph graph = new FlowGraph("NoEntry", "ghost", List.of(node("a")), List.of());

        assertThatThrownBy(() -> engine.layout(graph))
                .isInstanceOf(MissingEntryNodeException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void customSettingsApplied() {
        LayoutEngine custom = new LayoutEngine(new LayoutSettings(0, 0, 100, 40));
        FlowGraph graph = new FlowGraph("Custom", "a",
                List.of(node("a"), node("b"), node("c")),
                List.of(GraphEdge.condition("a", "1", "b"), GraphEdge.condition("a", "2", "c")));

        FlowLayout layout = custom.layout(graph);

        assertThat(layout.positionOf("a")).isEqualTo(new Position(0, 0));
        assertThat(layout.positionOf("c")).isEqualTo(new Position(100, 40));
    }

    @Test
    void invalidSpacingRejected() {
        assertThatThrownBy(() -> new LayoutSettings(0, 0, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spacing");
    }

    private static GraphNode node(String id) {
        return new GraphNode(id, "MessageParticipant", Map.of(), Map.of());
    }
}
