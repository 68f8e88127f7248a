package io.chatgate.core.normalize;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.DataUri;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.Turn;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Messages API shape. System turns are dropped and images become base64 source blocks;
 * an image whose URL is not a base64 data URI is left out.
 */
public final class AnthropicMessageNormalizer implements MessageNormalizer {

    @Override
    public List<Map<String, Object>> normalize(List<Turn> turns) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", turn.role() == MessageRole.ASSISTANT ? "assistant" : "user");
            row.put("content", turn.multipart() ? toContentBlocks(turn.parts()) : turn.text());
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toContentBlocks(List<ContentPart> parts) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part instanceof ContentPart.Text text) {
                blocks.add(Map.of("type", "text", "text", text.text()));
            } else if (part instanceof ContentPart.Image image) {
                Optional<DataUri> dataUri = image.dataUri();
                if (dataUri.isEmpty()) {
                    continue;
                }
                Map<String, Object> source = new LinkedHashMap<>();
                source.put("type", "base64");
                source.put("media_type", dataUri.get().mimeType());
                source.put("data", dataUri.get().base64Data());

                Map<String, Object> block = new LinkedHashMap<>();
                block.put("type", "image");
                block.put("source", source);
                blocks.add(block);
            }
        }
        return blocks;
    }
}
