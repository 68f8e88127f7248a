package io.chatgate.core.session;

import io.chatgate.core.model.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class InMemoryConversationStore implements ConversationStore {
    private final Map<String, Conversation> conversations = new LinkedHashMap<>();
    private final Map<String, List<StoredMessage>> messages = new LinkedHashMap<>();

    @Override
    public synchronized Conversation create(String title, String modelProvider, String modelName) {
        Conversation conversation = new Conversation(
            UUID.randomUUID().toString(),
            title,
            modelProvider,
            modelName,
            Instant.now()
        );
        conversations.put(conversation.id(), conversation);
        messages.put(conversation.id(), new ArrayList<>());
        return conversation;
    }

    @Override
    public synchronized Optional<Conversation> find(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public synchronized List<Conversation> list(int offset, int limit) {
        List<Conversation> newestFirst = new ArrayList<>(conversations.values());
        Collections.reverse(newestFirst);
        int from = Math.min(Math.max(0, offset), newestFirst.size());
        int to = Math.min(from + Math.max(0, limit), newestFirst.size());
        return List.copyOf(newestFirst.subList(from, to));
    }

    @Override
    public synchronized int count() {
        return conversations.size();
    }

    @Override
    public synchronized Optional<Conversation> update(Conversation conversation) {
        Conversation existing = conversations.get(conversation.id());
        if (existing == null) {
            return Optional.empty();
        }
        Conversation updated = new Conversation(
            existing.id(),
            conversation.title(),
            conversation.modelProvider(),
            conversation.modelName(),
            existing.createdAt()
        );
        conversations.put(updated.id(), updated);
        return Optional.of(updated);
    }

    @Override
    public synchronized boolean delete(String conversationId) {
        messages.remove(conversationId);
        return conversations.remove(conversationId) != null;
    }

    @Override
    public synchronized List<StoredMessage> messages(String conversationId) {
        return List.copyOf(messages.getOrDefault(conversationId, List.of()));
    }

    @Override
    public synchronized StoredMessage append(
        String conversationId,
        MessageRole role,
        String content,
        String modelName,
        List<String> images
    ) {
        List<StoredMessage> target = messages.get(conversationId);
        if (target == null) {
            throw new IllegalArgumentException("Unknown conversation: " + conversationId);
        }
        StoredMessage message = new StoredMessage(
            UUID.randomUUID().toString(),
            conversationId,
            role,
            content,
            modelName,
            images,
            Instant.now()
        );
        target.add(message);
        return message;
    }

    @Override
    public synchronized Optional<StoredMessage> findMessage(String messageId) {
        return messages.values().stream()
            .flatMap(List::stream)
            .filter(message -> message.id().equals(messageId))
            .findFirst();
    }

    @Override
    public synchronized Optional<StoredMessage> updateMessage(String messageId, String content, String modelName) {
        for (List<StoredMessage> thread : messages.values()) {
            for (int i = 0; i < thread.size(); i++) {
                StoredMessage existing = thread.get(i);
                if (existing.id().equals(messageId)) {
                    StoredMessage updated = new StoredMessage(
                        existing.id(),
                        existing.conversationId(),
                        existing.role(),
                        content,
                        modelName,
                        existing.images(),
                        existing.createdAt()
                    );
                    thread.set(i, updated);
                    return Optional.of(updated);
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized boolean deleteMessage(String messageId) {
        for (List<StoredMessage> thread : messages.values()) {
            if (thread.removeIf(message -> message.id().equals(messageId))) {
                return true;
            }
        }
        return false;
    }
}
