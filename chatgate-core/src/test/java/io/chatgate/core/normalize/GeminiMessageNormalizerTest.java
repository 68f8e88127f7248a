package io.chatgate.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.Turn;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GeminiMessageNormalizerTest {

    private final GeminiMessageNormalizer normalizer = new GeminiMessageNormalizer();

    @Test
    void shouldMapRolesAndWrapPlainTextInParts() {
        List<Map<String, Object>> contents = normalizer.normalize(List.of(
            Turn.system("ignored"),
            Turn.user("hi"),
            Turn.assistant("hello")
        ));

        assertThat(contents).containsExactly(
            Map.of("role", "user", "parts", List.of(Map.of("text", "hi"))),
            Map.of("role", "model", "parts", List.of(Map.of("text", "hello")))
        );
    }

    @Test
    void shouldConvertImagesToInlineDataAndDropMalformedOnes() {
        Turn turn = Turn.of(
            MessageRole.USER,
            List.of(
                ContentPart.text("describe"),
                ContentPart.image("data:image/webp;base64,UklG"),
                ContentPart.image("data:image/png,abc")
            )
        );

        List<Map<String, Object>> contents = normalizer.normalize(List.of(turn));

        assertThat(contents.get(0).get("parts")).isEqualTo(List.of(
            Map.of("text", "describe"),
            Map.of("inlineData", Map.of("mimeType", "image/webp", "data", "UklG"))
        ));
    }
}
