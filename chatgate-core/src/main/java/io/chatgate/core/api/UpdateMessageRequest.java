package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.chatgate.core.session.StoredMessage;

/**
 * Body of {@code PUT /messages/{id}}. An explicit {@code "model_name": null} clears the model name.
 */
record UpdateMessageRequest(String content, boolean modelNameGiven, String modelName) {

    static UpdateMessageRequest from(JsonNode body) {
        RequestValidator validator = new RequestValidator(body);
        String content = validator.optionalString("content", 0);
        boolean modelNameGiven = body.has("model_name");
        String modelName = validator.optionalString("model_name", 100);
        validator.throwIfInvalid();
        return new UpdateMessageRequest(content, modelNameGiven, modelName);
    }

    String contentFor(StoredMessage existing) {
        return content == null ? existing.content() : content;
    }

    String modelNameFor(StoredMessage existing) {
        return modelNameGiven ? modelName : existing.modelName();
    }
}
