package io.chatgate.core.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.provider.MalformedResponseException;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnthropicMessageResponse(List<ContentBlock> content, String model, Map<String, Object> usage) {

    public static AnthropicMessageResponse parse(ObjectMapper mapper, String body) {
        return ResponseReader.read(mapper, body, AnthropicMessageResponse.class, "Anthropic");
    }

    public GenerationResult toResult(String requestedModel) {
        ContentBlock block = ResponseReader.first(content, "content[0]");
        if (block.text() == null) {
            throw new MalformedResponseException("response is missing content[0].text");
        }
        String echoed = model == null || model.isBlank() ? requestedModel : model;
        return new GenerationResult(block.text(), echoed, usage);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentBlock(String type, String text) {
    }
}
