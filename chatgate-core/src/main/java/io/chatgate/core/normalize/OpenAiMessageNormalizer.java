package io.chatgate.core.normalize;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.Turn;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions message shape shared by OpenAI, DeepSeek and Mistral.
 * System turns are kept; image URLs are forwarded as given.
 */
public final class OpenAiMessageNormalizer implements MessageNormalizer {

    @Override
    public List<Map<String, Object>> normalize(List<Turn> turns) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Turn turn : turns) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", turn.role().wireValue());
            row.put("content", turn.multipart() ? toWireParts(turn.parts()) : turn.text());
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireParts(List<ContentPart> parts) {
        List<Map<String, Object>> content = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part instanceof ContentPart.Text text) {
                content.add(Map.of("type", "text", "text", text.text()));
            } else if (part instanceof ContentPart.Image image) {
                content.add(Map.of("type", "image_url", "image_url", Map.of("url", image.url())));
            }
        }
        return content;
    }
}
