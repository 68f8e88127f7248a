package io.chatgate.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.Turn;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnthropicMessageNormalizerTest {

    private final AnthropicMessageNormalizer normalizer = new AnthropicMessageNormalizer();

    @Test
    void shouldConvertTextAndImageIntoTwoBlocksInOrder() {
        Turn turn = Turn.of(
            MessageRole.USER,
            List.of(ContentPart.text("what is this?"), ContentPart.image("data:image/jpeg;base64,/9j/4AAQ"))
        );

        List<Map<String, Object>> wire = normalizer.normalize(List.of(turn));

        assertThat(wire).hasSize(1);
        assertThat(wire.get(0)).containsEntry("role", "user");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> blocks = (List<Map<String, Object>>) wire.get(0).get("content");
        assertThat(blocks).hasSize(2);
        assertThat(blocks.get(0)).isEqualTo(Map.of("type", "text", "text", "what is this?"));
        assertThat(blocks.get(1)).containsEntry("type", "image");
        assertThat(blocks.get(1).get("source")).isEqualTo(Map.of(
            "type", "base64",
            "media_type", "image/jpeg",
            "data", "/9j/4AAQ"
        ));
    }

    @Test
    void shouldDropImageWithoutBase64Delimiter() {
        Turn turn = Turn.of(MessageRole.USER, List.of(ContentPart.image("data:image/png,abc")));

        List<Map<String, Object>> wire = normalizer.normalize(List.of(turn));

        assertThat(wire).hasSize(1);
        assertThat((List<?>) wire.get(0).get("content")).isEmpty();
    }

    @Test
    void shouldFilterSystemTurnsAndKeepPlainTextAsString() {
        List<Map<String, Object>> wire = normalizer.normalize(List.of(
            Turn.system("be brief"),
            Turn.user("hi"),
            Turn.assistant("hello")
        ));

        assertThat(wire).containsExactly(
            Map.of("role", "user", "content", "hi"),
            Map.of("role", "assistant", "content", "hello")
        );
    }
}
