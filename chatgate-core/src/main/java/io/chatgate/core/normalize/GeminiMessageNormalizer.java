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
 * generateContent {@code contents} shape: roles {@code user}/{@code model}, every turn a {@code parts} list.
 */
public final class GeminiMessageNormalizer implements MessageNormalizer {

    @Override
    public List<Map<String, Object>> normalize(List<Turn> turns) {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", turn.role() == MessageRole.ASSISTANT ? "model" : "user");
            row.put("parts", turn.multipart() ? toParts(turn.parts()) : List.of(Map.of("text", turn.text())));
            contents.add(row);
        }
        return contents;
    }

    private List<Map<String, Object>> toParts(List<ContentPart> parts) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part instanceof ContentPart.Text text) {
                wire.add(Map.of("text", text.text()));
            } else if (part instanceof ContentPart.Image image) {
                Optional<DataUri> dataUri = image.dataUri();
                if (dataUri.isPresent()) {
                    Map<String, Object> inlineData = new LinkedHashMap<>();
                    inlineData.put("mimeType", dataUri.get().mimeType());
                    inlineData.put("data", dataUri.get().base64Data());
                    wire.add(Map.of("inlineData", inlineData));
                }
            }
        }
        return wire;
    }
}
