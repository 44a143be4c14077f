package ai.eigloo.contactflow.graph.decompiler;

import ai.eigloo.contactflow.graph.TestResourceUtils;
import ai.eigloo.contactflow.graph.builder.FlowBuilder;
import ai.eigloo.contactflow.graph.builder.NodeHandle;
import ai.eigloo.contactflow.graph.compiler.CompilationResult;
import ai.eigloo.contactflow.graph.compiler.FlowCompiler;
import ai.eigloo.contactflow.graph.exception.DanglingTransitionException;
import ai.eigloo.contactflow.graph.exception.DuplicateNodeIdException;
import ai.eigloo.contactflow.graph.exception.FlowErrorCode;
import ai.eigloo.contactflow.graph.exception.MalformedDocumentException;
import ai.eigloo.contactflow.graph.exception.MissingEntryNodeException;
import ai.eigloo.contactflow.graph.exception.ReservedTransitionKeyException;
import ai.eigloo.contactflow.graph.exception.UnknownTransitionKeyException;
import ai.eigloo.contactflow.graph.model.Block;
import ai.eigloo.contactflow.graph.model.EdgeKind;
import ai.eigloo.contactflow.graph.model.FlowGraph;
import ai.eigloo.contactflow.graph.model.GraphEdge;
import ai.eigloo.contactflow.graph.model.GraphNode;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowDecompilerTest {

    private FlowDecompiler decompiler;
    private FlowCompiler compiler;

    @BeforeEach
    void setUp() {
        decompiler = new FlowDecompiler();
        compiler = new FlowCompiler();
    }

    @Test
    void roundTripPreservesGraph() {
        // Given
        FlowGraph original = menuWithLoop();

        // When
        FlowGraph restored = decompiler.decompile(compiler.compile(original).toJson());

        // Then
        assertThat(restored.name()).isEqualTo(original.name());
        assertThat(restored.entryNodeId()).isEqualTo(original.entryNodeId());
        assertThat(restored.nodes()).containsExactlyElementsOf(original.nodes());
        assertThat(new HashSet<>(restored.edges())).isEqualTo(new HashSet<>(original.edges()));
    }

    @Test
    void cyclesSurviveRoundTrip() {
        FlowGraph restored = decompiler.decompile(compiler.compile(menuWithLoop()).document());

        assertThat(restored.edges()).contains(
                GraphEdge.otherwise("menu", "menu"),
                GraphEdge.error("menu", "InputTimeLimitExceeded", "welcome"));
    }

    @Test
    void decompilesThirdPartyDocument() {
        // When
        FlowGraph graph = decompiler.decompile(TestResourceUtils.readResource("wire_documents/support_line.json"));

        // Then
        assertThat(graph.name()).isEqualTo("Support Line");
        assertThat(graph.description()).isEqualTo("Imported support flow");
        assertThat(graph.entryNodeId()).isEqualTo("greeting");
        assertThat(graph.nodeIds()).containsExactly(
                "greeting", "lookup", "menu", "billing", "tech", "goodbye", "legacy");
        assertThat(graph.edgeCount()).isEqualTo(11);

        GraphNode menu = graph.getNode("menu");
        assertThat(menu.extraFields().get("Comment").asText()).isEqualTo("main menu");
        assertThat(menu.parameter("DTMFConfiguration").get("InputTerminationSequence").asText()).isEqualTo("#");
        assertThat(graph.outgoing("menu")).containsExactly(
                GraphEdge.condition("menu", "1", "billing"),
                GraphEdge.condition("menu", "2", "tech"),
                GraphEdge.otherwise("menu", "menu"),
                GraphEdge.error("menu", "InputTimeLimitExceeded", "menu"),
                GraphEdge.error("menu", "NoMatchingError", "goodbye"));

        assertThat(graph.getNode("billing").textParameter("ContactFlowId")).isEqualTo("${BILLING_FLOW_ID}");
        assertThat(graph.getNode("legacy").parameter("Retries").asInt()).isEqualTo(3);
        assertThat(graph.extensions()).containsOnlyKeys("Tags");
        assertThat(graph.extensions().get("Tags").get("team").asText()).isEqualTo("support");
    }

    @Test
    void decompiledThirdPartyDocumentRecompilesWithFreshLayout() {
        FlowGraph graph = decompiler.decompile(TestResourceUtils.readResource("wire_documents/support_line.json"));

        CompilationResult result = compiler.compile(graph);

        assertThat(result.layout().rankOf("greeting")).isZero();
        assertThat(result.layout().rankOf("lookup")).isEqualTo(1);
        assertThat(result.layout().rankOf("menu")).isEqualTo(2);
        assertThat(result.layout().rankOf("goodbye")).isEqualTo(2);
        assertThat(result.layout().rankOf("billing")).isEqualTo(3);
        assertThat(result.layout().rankOf("tech")).isEqualTo(3);
        assertThat(result.layout().orphanNodeIds()).containsExactly("legacy");
        assertThat(result.layout().rankOf("legacy")).isEqualTo(4);
        assertThat(result.document().get("Metadata").get("snapToGrid").asBoolean()).isFalse();
        assertThat(result.document().get("Tags").get("team").asText()).isEqualTo("support");
    }

    @Test
    void recompilationIsStable() {
        FlowGraph first = decompiler.decompile(TestResourceUtils.readResource("wire_documents/support_line.json"));
        String compiled = compiler.compileToJson(first);

        String recompiled = compiler.compileToJson(decompiler.decompile(compiled));

        assertThat(recompiled).isEqualTo(compiled);
    }

    @Test
    void missingNameAllowed() {
        FlowGraph graph = decompiler.decompile("""
                {"StartAction": "a", "Actions": [{"Identifier": "a", "Type": "DisconnectParticipant"}]}
                """);

        assertThat(graph.name()).isNull();
        assertThat(graph.version()).isEqualTo("2019-10-30");
        assertThat(graph.getNode("a").parameters()).isEmpty();
    }

    @Test
    void invalidJsonRejected() {
        assertThatThrownBy(() -> decompiler.decompile("{not json"))
                .isInstanceOf(MalformedDocumentException.class)
                .hasFieldOrPropertyWithValue("code", FlowErrorCode.MALFORMED_DOCUMENT);
    }

    @Test
    void missingRequiredFieldsRejected() {
        assertThatThrownBy(() -> decompiler.decompile("[]"))
                .isInstanceOf(MalformedDocumentException.class);
        assertThatThrownBy(() -> decompiler.decompile("{\"Actions\": []}"))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("StartAction");
        assertThatThrownBy(() -> decompiler.decompile("{\"StartAction\": \"a\"}"))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("Actions");
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [{"Identifier": "a"}]}
                """))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("/Actions/0/Type");
    }

    @Test
    void startActionMustNameRecord() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "ghost", "Actions": [{"Identifier": "a", "Type": "DisconnectParticipant"}]}
                """))
                .isInstanceOf(MissingEntryNodeException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void danglingTransitionRejected() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant", "Transitions": {"Success": "ghost"}}
                ]}
                """))
                .isInstanceOf(DanglingTransitionException.class)
                .hasFieldOrPropertyWithValue("nodeId", "a")
                .hasMessageContaining("ghost");
    }

    @Test
    void unmappableTransitionKeysRejected() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "GetParticipantInput", "Transitions": {"": "a"}}
                ]}
                """))
                .isInstanceOf(UnknownTransitionKeyException.class);
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "GetParticipantInput", "Transitions": {"1": {"to": "a"}}}
                ]}
                """))
                .isInstanceOf(UnknownTransitionKeyException.class)
                .hasFieldOrPropertyWithValue("code", FlowErrorCode.UNKNOWN_TRANSITION_KEY);
    }

    @Test
    void illTypedTransitionsRejected() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant", "Transitions": {"Success": 7}}
                ]}
                """))
                .isInstanceOf(MalformedDocumentException.class);
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant", "Transitions": {"Errors": "a"}}
                ]}
                """))
                .isInstanceOf(MalformedDocumentException.class);
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant", "Transitions": ["a"]}
                ]}
                """))
                .isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    void duplicateIdentifiersRejected() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant"},
                  {"Identifier": "a", "Type": "DisconnectParticipant"}
                ]}
                """))
                .isInstanceOf(DuplicateNodeIdException.class);
    }

    @Test
    void errorsKeyNestedInsideErrorsIsAnErrorCode() {
        FlowGraph graph = decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "InvokeLambdaFunction", "Transitions": {"Errors": {"Default": "a"}}}
                ]}
                """);

        assertThat(graph.edges()).singleElement()
                .satisfies(edge -> {
                    assertThat(edge.kind()).isEqualTo(EdgeKind.ERROR);
                    assertThat(edge.label()).isEqualTo("Default");
                });
    }

    @Test
    void reservedValuesCannotBeBuiltSoNeverReachTheWire() {
        FlowBuilder flow = new FlowBuilder("Reserved");
        NodeHandle a = flow.add(Block.of("a", "GetParticipantInput"));

        assertThatThrownBy(() -> a.when("Default", a))
                .isInstanceOf(ReservedTransitionKeyException.class);
    }

    @Test
    void decimalParametersKeepExactValue() {
        // Given
        FlowBuilder flow = new FlowBuilder("Decimals");
        flow.add(Block.of("weigh", "UpdateContactAttributes")
                .parameter("Weight", new BigDecimal("1.10"))
                .parameter("Ratio", 0.25));

        // When
        FlowGraph original = flow.build();
        FlowGraph restored = decompiler.decompile(compiler.compileToJson(original));

        // Then
        assertThat(restored.nodes()).containsExactlyElementsOf(original.nodes());
        assertThat(restored.getNode("weigh").parameter("Weight").decimalValue()).isEqualTo(new BigDecimal("1.10"));
    }

    @Test
    void largeThirdPartyNumbersAreNotRounded() {
        String document = """
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "CustomWidget",
                   "Parameters": {"Big": 12345678901234567890.123456789, "Count": 98765432109876543210}}
                ]}
                """;

        String recompiled = compiler.compile(decompiler.decompile(document)).toJson(false);

        assertThat(recompiled)
                .contains("\"Big\":12345678901234567890.123456789")
                .contains("\"Count\":98765432109876543210");
    }

    @Test
    void emptyKeysInThirdPartyRecordsArePreserved() {
        String document = """
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "CustomWidget", "Parameters": {"": "v"}, "": "extra"}
                ]}
                """;

        FlowGraph graph = decompiler.decompile(document);
        JsonNode record = compiler.compile(graph).document().get("Actions").get(0);

        assertThat(graph.getNode("a").parameter("").asText()).isEqualTo("v");
        assertThat(graph.getNode("a").extraFields().get("").asText()).isEqualTo("extra");
        assertThat(record.get("Parameters").get("").asText()).isEqualTo("v");
        assertThat(record.get("").asText()).isEqualTo("extra");
    }

    @Test
    void repeatedKeysRejected() {
        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "Actions": [
                  {"Identifier": "a", "Type": "MessageParticipant", "Transitions": {"Success": "a", "Success": "b"}},
                  {"Identifier": "b", "Type": "DisconnectParticipant"}
                ]}
                """))
                .isInstanceOf(MalformedDocumentException.class)
                .hasMessageContaining("Success");

        assertThatThrownBy(() -> decompiler.decompile("""
                {"StartAction": "a", "StartAction": "b", "Actions": []}
                """))
                .isInstanceOf(MalformedDocumentException.class);
    }

    private static FlowGraph menuWithLoop() {
        FlowBuilder flow = new FlowBuilder("Loop Menu");
        NodeHandle welcome = flow.add(Block.of("welcome", "MessageParticipant").parameter("Text", "Hi"));
        NodeHandle menu = flow.add(Block.of("menu", "GetParticipantInput")
                .parameter("Text", "Press 1")
                .parameter("InputTimeLimitSeconds", "5")
                .extraField("Comment", "loops on bad input"));
        NodeHandle done = flow.add(Block.of("done", "DisconnectParticipant"));
        welcome.then(menu);
        menu.onError("InputTimeLimitExceeded", welcome)
                .when("1", done)
                .otherwise(menu);
        return flow.build();
    }
}
