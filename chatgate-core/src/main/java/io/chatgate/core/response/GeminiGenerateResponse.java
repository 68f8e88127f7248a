package io.chatgate.core.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.provider.MalformedResponseException;
import java.util.List;
import java.util.Map;

/**
 * generateContent body. The API does not echo the model, so the requested id is reported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiGenerateResponse(List<Candidate> candidates, Map<String, Object> usageMetadata) {

    public static GeminiGenerateResponse parse(ObjectMapper mapper, String body) {
        return ResponseReader.read(mapper, body, GeminiGenerateResponse.class, "Gemini");
    }

    public GenerationResult toResult(String requestedModel) {
        Candidate candidate = ResponseReader.first(candidates, "candidates[0]");
        if (candidate.content() == null) {
            throw new MalformedResponseException("response is missing candidates[0].content");
        }
        Part part = ResponseReader.first(candidate.content().parts(), "candidates[0].content.parts[0]");
        if (part.text() == null) {
            throw new MalformedResponseException("response is missing candidates[0].content.parts[0].text");
        }
        return new GenerationResult(part.text(), requestedModel, usageMetadata);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Candidate(Content content, String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String role, List<Part> parts) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Part(String text) {
    }
}
