package io.chatgate.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chatgate.core.model.MessageRole;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteConversationStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistConversationAndMessages() throws Exception {
        Path dbPath = tempDir.resolve("data/chatgate.db");
        SqliteConversationStore store = new SqliteConversationStore(dbPath);
        Conversation conversation = store.create("Trip planning", "anthropic", "claude-3-5-sonnet");

        store.append(conversation.id(), MessageRole.USER, "what is in this photo?", null, List.of("data:image/png;base64,iVBO"));
        store.append(conversation.id(), MessageRole.ASSISTANT, "a beach", "claude-3-5-sonnet-20241022", List.of());

        SqliteConversationStore reopened = new SqliteConversationStore(dbPath);
        assertThat(reopened.find(conversation.id())).contains(conversation);
        List<StoredMessage> messages = reopened.messages(conversation.id());
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).role()).isEqualTo(MessageRole.USER);
        assertThat(messages.get(0).images()).containsExactly("data:image/png;base64,iVBO");
        assertThat(messages.get(0).modelName()).isNull();
        assertThat(messages.get(1).content()).isEqualTo("a beach");
        assertThat(messages.get(1).modelName()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(messages.get(1).hasImages()).isFalse();
    }

    @Test
    void shouldKeepInsertionOrderForRapidAppends() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));
        Conversation conversation = store.create(null, "openai", "gpt-4o");
        for (int i = 0; i < 20; i++) {
            store.append(conversation.id(), i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT, "m" + i, null, null);
        }

        List<StoredMessage> messages = store.messages(conversation.id());

        assertThat(messages).extracting(StoredMessage::content)
            .containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9",
                "m10", "m11", "m12", "m13", "m14", "m15", "m16", "m17", "m18", "m19");
        assertThat(conversation.title()).isEqualTo("New conversation");
    }

    @Test
    void shouldReturnEmptyResultsForUnknownConversation() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));

        assertThat(store.find("missing")).isEmpty();
        assertThat(store.messages("missing")).isEmpty();
        assertThatThrownBy(() -> store.append("missing", MessageRole.USER, "hi", null, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldListConversationsNewestFirstAndPage() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));
        Conversation first = store.create("first", "openai", "gpt-4o");
        Conversation second = store.create("second", "openai", "gpt-4o");
        Conversation third = store.create("third", "gemini", "gemini-pro");

        assertThat(store.count()).isEqualTo(3);
        assertThat(store.list(0, 20)).extracting(Conversation::id).containsExactly(third.id(), second.id(), first.id());
        assertThat(store.list(1, 1)).extracting(Conversation::id).containsExactly(second.id());
        assertThat(store.list(3, 20)).isEmpty();
    }

    @Test
    void shouldUpdateConversationButKeepCreationTime() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));
        Conversation conversation = store.create("Draft", "openai", "gpt-4o");

        Conversation renamed = new Conversation(conversation.id(), "Final", "mistral", "mistral-large", conversation.createdAt());
        assertThat(store.update(renamed)).contains(renamed);
        assertThat(store.find(conversation.id())).contains(renamed);

        Conversation unknown = new Conversation("missing", "x", "openai", "gpt-4o", conversation.createdAt());
        assertThat(store.update(unknown)).isEmpty();
    }

    @Test
    void shouldDeleteConversationTogetherWithItsMessages() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));
        Conversation doomed = store.create("doomed", "openai", "gpt-4o");
        Conversation kept = store.create("kept", "openai", "gpt-4o");
        StoredMessage doomedMessage = store.append(doomed.id(), MessageRole.USER, "bye", null, List.of());
        store.append(kept.id(), MessageRole.USER, "stay", null, List.of());

        assertThat(store.delete(doomed.id())).isTrue();
        assertThat(store.delete(doomed.id())).isFalse();

        assertThat(store.find(doomed.id())).isEmpty();
        assertThat(store.findMessage(doomedMessage.id())).isEmpty();
        assertThat(store.messages(kept.id())).extracting(StoredMessage::content).containsExactly("stay");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldFindUpdateAndDeleteSingleMessages() throws Exception {
        SqliteConversationStore store = new SqliteConversationStore(tempDir.resolve("chatgate.db"));
        Conversation conversation = store.create(null, "openai", "gpt-4o");
        StoredMessage question = store.append(
            conversation.id(), MessageRole.USER, "look", null, List.of("data:image/gif;base64,R0lG"));
        StoredMessage answer = store.append(conversation.id(), MessageRole.ASSISTANT, "a cat", "gpt-4o-2024-08-06", List.of());

        assertThat(store.findMessage(question.id())).contains(question);

        StoredMessage edited = store.updateMessage(question.id(), "look closer", null).orElseThrow();
        assertThat(edited.content()).isEqualTo("look closer");
        assertThat(edited.role()).isEqualTo(MessageRole.USER);
        assertThat(edited.images()).containsExactly("data:image/gif;base64,R0lG");
        assertThat(edited.createdAt()).isEqualTo(question.createdAt());
        assertThat(store.updateMessage("missing", "x", null)).isEmpty();

        assertThat(store.deleteMessage(answer.id())).isTrue();
        assertThat(store.deleteMessage(answer.id())).isFalse();
        assertThat(store.messages(conversation.id())).extracting(StoredMessage::content).containsExactly("look closer");
    }
}
