package io.chatgate.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.Turn;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConversationHistoryTest {

    @Test
    void shouldRebuildPlainAndImageTurnsInOrder() {
        InMemoryConversationStore store = new InMemoryConversationStore();
        Conversation conversation = store.create("t", "gemini", "gemini-2.0-flash");
        store.append(conversation.id(), MessageRole.USER, "hello", null, List.of());
        store.append(conversation.id(), MessageRole.ASSISTANT, "hi", "gemini-2.0-flash", List.of());
        store.append(conversation.id(), MessageRole.USER, "and this?", null, List.of("data:image/gif;base64,R0lG"));

        List<Turn> turns = ConversationHistory.toTurns(store.messages(conversation.id()));

        assertThat(turns).hasSize(3);
        assertThat(turns.get(0)).isEqualTo(Turn.user("hello"));
        assertThat(turns.get(1)).isEqualTo(Turn.assistant("hi"));
        assertThat(turns.get(2).role()).isEqualTo(MessageRole.USER);
        assertThat(turns.get(2).parts()).containsExactly(
            ContentPart.text("and this?"),
            ContentPart.image("data:image/gif;base64,R0lG")
        );
    }
}
