package io.chatgate.core.session;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.Turn;
import java.util.ArrayList;
import java.util.List;

public final class ConversationHistory {

    private ConversationHistory() {
    }

    /**
     * Rebuilds the provider turn list from stored messages. Messages with images become
     * {@code [Text, Image...]}; the rest stay plain text.
     */
    public static List<Turn> toTurns(List<StoredMessage> messages) {
        List<Turn> turns = new ArrayList<>(messages.size());
        for (StoredMessage message : messages) {
            if (!message.hasImages()) {
                turns.add(new Turn(message.role(), message.content(), List.of()));
                continue;
            }
            List<ContentPart> parts = new ArrayList<>();
            parts.add(ContentPart.text(message.content()));
            for (String image : message.images()) {
                parts.add(ContentPart.image(image));
            }
            turns.add(Turn.of(message.role(), parts));
        }
        return turns;
    }
}
