package io.chatgate.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.normalize.AnthropicMessageNormalizer;
import io.chatgate.core.response.AnthropicMessageResponse;
import io.chatgate.core.stream.DeltaSource;
import io.chatgate.core.stream.SimulatedStreaming;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * Messages API. Streaming is replayed from the full response.
 */
public final class AnthropicAdapter extends AbstractProviderAdapter {
    static final String API_VERSION = "2023-06-01";

    private final SimulatedStreaming simulatedStreaming;

    public AnthropicAdapter(OkHttpClient client, ObjectMapper mapper, SimulatedStreaming simulatedStreaming) {
        super(Provider.ANTHROPIC, new AnthropicMessageNormalizer(), client, mapper);
        this.simulatedStreaming = simulatedStreaming;
    }

    @Override
    public Request buildRequest(ProviderCall call, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", call.model());
        payload.put("messages", normalize(call.turns()));
        payload.put("max_tokens", call.options().maxTokens());
        payload.put("temperature", call.options().temperature());

        return new Request.Builder()
            .url(messagesUrl(call.descriptor()))
            .post(jsonBody(payload))
            .header("x-api-key", call.apiKey())
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .build();
    }

    @Override
    public GenerationResult parseFull(String body, String requestedModel) {
        return AnthropicMessageResponse.parse(mapper, body).toResult(requestedModel);
    }

    @Override
    public DeltaSource decodeStream(ProviderCall call) {
        return simulatedStreaming.replay(complete(call).content());
    }

    private HttpUrl messagesUrl(ProviderDescriptor descriptor) {
        return HttpUrl.get(descriptor.baseUrl()).newBuilder()
            .addPathSegment("messages")
            .build();
    }
}
