package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatgate.core.provider.Provider;
import java.util.Locale;

/**
 * Body of {@code POST /conversations}. Provider and model are stored lower-cased.
 */
record CreateConversationRequest(String title, String modelProvider, String modelName) {

    static CreateConversationRequest from(JsonNode body) {
        RequestValidator validator = new RequestValidator(body);
        CreateConversationRequest request = read(validator);
        validator.throwIfInvalid();
        return request;
    }

    /**
     * Reads the conversation fields, recording problems on {@code validator} without throwing.
     */
    static CreateConversationRequest read(RequestValidator validator) {
        String title = validator.optionalString("title", 255);
        String provider = validator.requiredString("model_provider", 50);
        String model = validator.requiredString("model_name", 100);
        if (provider != null && Provider.fromKey(provider).isEmpty()) {
            validator.reject("model_provider", MessageRequest.PROVIDER_MESSAGE);
        }
        return new CreateConversationRequest(title, lower(provider), lower(model));
    }

    static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
