package io.chatgate.core.session;

import io.chatgate.core.model.MessageRole;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A persisted chat message. {@code images} holds data URIs; {@code modelName} is set on assistant
 * messages only.
 */
public record StoredMessage(
    String id,
    String conversationId,
    MessageRole role,
    String content,
    String modelName,
    List<String> images,
    Instant createdAt
) {

    public StoredMessage {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        images = images == null ? List.of() : List.copyOf(images);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }
}
