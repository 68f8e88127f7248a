package io.chatgate.core.session;

import java.time.Instant;
import java.util.Objects;

public record Conversation(String id, String title, String modelProvider, String modelName, Instant createdAt) {

    public Conversation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(modelProvider, "modelProvider must not be null");
        Objects.requireNonNull(modelName, "modelName must not be null");
        title = title == null || title.isBlank() ? "New conversation" : title;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }
}
