package io.chatgate.core.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.provider.MalformedResponseException;
import java.util.List;
import java.util.Map;

/**
 * Non-streaming chat-completions body (OpenAI, DeepSeek, Mistral).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenAiChatResponse(List<Choice> choices, String model, Map<String, Object> usage) {

    public static OpenAiChatResponse parse(ObjectMapper mapper, String body) {
        return ResponseReader.read(mapper, body, OpenAiChatResponse.class, "chat-completions API");
    }

    public GenerationResult toResult(String requestedModel) {
        Choice choice = ResponseReader.first(choices, "choices[0]");
        if (choice.message() == null || choice.message().content() == null) {
            throw new MalformedResponseException("response is missing choices[0].message.content");
        }
        String echoed = model == null || model.isBlank() ? requestedModel : model;
        return new GenerationResult(choice.message().content(), echoed, usage);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {
    }
}
