package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatgate.core.model.GenerationOptions;

/**
 * Body of {@code POST /conversations/start}: the conversation fields plus the opening message.
 */
record StartConversationRequest(CreateConversationRequest conversation, String content, GenerationOptions options) {

    static StartConversationRequest from(JsonNode body) {
        RequestValidator validator = new RequestValidator(body);
        CreateConversationRequest conversation = CreateConversationRequest.read(validator);
        String content = validator.requiredString("content", 0);
        GenerationOptions options = MessageRequest.readOptions(validator);
        validator.throwIfInvalid();
        return new StartConversationRequest(conversation, content, options);
    }
}
