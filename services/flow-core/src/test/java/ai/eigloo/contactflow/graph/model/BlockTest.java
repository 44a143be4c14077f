package ai.eigloo.contactflow.graph.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockTest {

    @Test
    void parametersKeepInsertionOrderAndJsonShape() {
        Block block = Block.of("lex", "ConnectParticipantWithLexBot")
                .parameter("Text", "How can I help?")
                .parameter("LexV2Bot", Map.of("AliasArn", "{{BOT_ALIAS_ARN}}"))
                .parameter("Retries", 2)
                .parameter("Locales", List.of("en_US", "es_US"));

        assertThat(block.parameters().keySet()).containsExactly("Text", "LexV2Bot", "Retries", "Locales");
        JsonNode bot = block.parameters().get("LexV2Bot");
        assertThat(bot.get("AliasArn").asText()).isEqualTo("{{BOT_ALIAS_ARN}}");
        assertThat(block.parameters().get("Retries").isInt()).isTrue();
        assertThat(block.parameters().get("Locales").isArray()).isTrue();
    }

    @Test
    void parameterReplacesAndRemoves() {
        Block block = Block.of("p", "MessageParticipant").parameter("Text", "one");

        block.parameter("Text", "two");
        assertThat(block.parameters().get("Text").asText()).isEqualTo("two");

        block.removeParameter("Text");
        assertThat(block.parameters()).isEmpty();
    }

    @Test
    void rejectsCompilerManagedExtraFields() {
        Block block = Block.of("p", "MessageParticipant");

        assertThatThrownBy(() -> block.extraField("Transitions", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("managed by the compiler");
    }

    @Test
    void rejectsBlankIdOrType() {
        assertThatThrownBy(() -> Block.of("", "MessageParticipant"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Block id");
        assertThatThrownBy(() -> Block.of("p", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Block type");
    }

    @Test
    void snapshotIsDetachedFromBlock() {
        Block block = Block.of("p", "MessageParticipant").parameter("Text", "before");

        GraphNode snapshot = GraphNode.copyOf(block);
        block.parameter("Text", "after");

        assertThat(snapshot.textParameter("Text")).isEqualTo("before");
        assertThat(GraphNode.copyOf(snapshot)).isSameAs(snapshot);
    }
}
