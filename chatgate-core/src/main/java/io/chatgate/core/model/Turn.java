package io.chatgate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One message of a conversation as handed to a provider. A turn is plain text when
 * {@code parts} is empty and multi-part otherwise.
 */
public record Turn(MessageRole role, String text, List<ContentPart> parts) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        text = text == null ? "" : text;
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public static Turn system(String text) {
        return new Turn(MessageRole.SYSTEM, text, List.of());
    }

    public static Turn user(String text) {
        return new Turn(MessageRole.USER, text, List.of());
    }

    public static Turn assistant(String text) {
        return new Turn(MessageRole.ASSISTANT, text, List.of());
    }

    public static Turn of(MessageRole role, List<ContentPart> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("a multi-part turn needs at least one part");
        }
        return new Turn(role, "", parts);
    }

    public boolean multipart() {
        return !parts.isEmpty();
    }

    public boolean hasImages() {
        return parts.stream().anyMatch(part -> part instanceof ContentPart.Image);
    }
}
