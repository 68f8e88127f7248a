package io.chatgate.core.session;

import io.chatgate.core.model.MessageRole;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ConversationStore {

    Conversation create(String title, String modelProvider, String modelName) throws IOException;

    Optional<Conversation> find(String conversationId) throws IOException;

    /**
     * One page of conversations, newest first.
     */
    List<Conversation> list(int offset, int limit) throws IOException;

    int count() throws IOException;

    /**
     * Replaces title, provider and model of the stored conversation with the same id. Empty when
     * no such conversation exists.
     */
    Optional<Conversation> update(Conversation conversation) throws IOException;

    /**
     * Deletes the conversation together with its messages.
     */
    boolean delete(String conversationId) throws IOException;

    /**
     * Messages of a conversation, oldest first.
     */
    List<StoredMessage> messages(String conversationId) throws IOException;

    StoredMessage append(
        String conversationId,
        MessageRole role,
        String content,
        String modelName,
        List<String> images
    ) throws IOException;

    Optional<StoredMessage> findMessage(String messageId) throws IOException;

    Optional<StoredMessage> updateMessage(String messageId, String content, String modelName) throws IOException;

    boolean deleteMessage(String messageId) throws IOException;
}
