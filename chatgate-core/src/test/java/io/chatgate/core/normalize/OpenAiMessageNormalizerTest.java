package io.chatgate.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.Turn;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OpenAiMessageNormalizerTest {

    private final OpenAiMessageNormalizer normalizer = new OpenAiMessageNormalizer();

    @Test
    void shouldKeepSystemTurnsAndPlainText() {
        List<Map<String, Object>> wire = normalizer.normalize(List.of(Turn.system("be brief"), Turn.user("hi")));

        assertThat(wire).containsExactly(
            Map.of("role", "system", "content", "be brief"),
            Map.of("role", "user", "content", "hi")
        );
    }

    @Test
    void shouldForwardImageUrlsUnchanged() {
        Turn turn = Turn.of(
            MessageRole.USER,
            List.of(ContentPart.text("compare"), ContentPart.image("data:image/png;base64,iVBO"), ContentPart.image("data:image/png,abc"))
        );

        List<Map<String, Object>> wire = normalizer.normalize(List.of(turn));

        assertThat(wire.get(0).get("content")).isEqualTo(List.of(
            Map.of("type", "text", "text", "compare"),
            Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png;base64,iVBO")),
            Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png,abc"))
        ));
    }
}
