package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatgate.core.provider.Provider;
import io.chatgate.core.session.Conversation;

/**
 * Body of {@code PUT /conversations/{id}}. Absent fields keep their stored value.
 */
record UpdateConversationRequest(String title, String modelProvider, String modelName) {

    static UpdateConversationRequest from(JsonNode body) {
        RequestValidator validator = new RequestValidator(body);
        String title = validator.optionalString("title", 255);
        String provider = validator.optionalString("model_provider", 50);
        String model = validator.optionalString("model_name", 100);
        if (provider != null && Provider.fromKey(provider).isEmpty()) {
            validator.reject("model_provider", MessageRequest.PROVIDER_MESSAGE);
        }
        validator.throwIfInvalid();
        return new UpdateConversationRequest(
            title,
            CreateConversationRequest.lower(provider),
            CreateConversationRequest.lower(model)
        );
    }

    Conversation applyTo(Conversation existing) {
        return new Conversation(
            existing.id(),
            title == null ? existing.title() : title,
            modelProvider == null ? existing.modelProvider() : modelProvider,
            modelName == null ? existing.modelName() : modelName,
            existing.createdAt()
        );
    }
}
