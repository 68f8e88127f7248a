package io.chatgate.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.normalize.GeminiMessageNormalizer;
import io.chatgate.core.response.GeminiGenerateResponse;
import io.chatgate.core.stream.DeltaSource;
import io.chatgate.core.stream.SimulatedStreaming;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code <base>/<model>:generateContent?key=<key>}. Streaming is replayed from the full response.
 */
public final class GeminiAdapter extends AbstractProviderAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiAdapter.class);

    private final SimulatedStreaming simulatedStreaming;

    public GeminiAdapter(OkHttpClient client, ObjectMapper mapper, SimulatedStreaming simulatedStreaming) {
        super(Provider.GEMINI, new GeminiMessageNormalizer(), client, mapper);
        this.simulatedStreaming = simulatedStreaming;
    }

    @Override
    public Request buildRequest(ProviderCall call, boolean stream) {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", call.options().maxTokens());
        generationConfig.put("temperature", call.options().temperature());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", normalize(call.turns()));
        payload.put("generationConfig", generationConfig);

        HttpUrl url = generateUrl(call);
        LOG.debug("Gemini request URL: {}", redact(url));
        return new Request.Builder()
            .url(url)
            .post(jsonBody(payload))
            .header("Content-Type", "application/json")
            .build();
    }

    @Override
    public GenerationResult parseFull(String body, String requestedModel) {
        return GeminiGenerateResponse.parse(mapper, body).toResult(requestedModel);
    }

    @Override
    public DeltaSource decodeStream(ProviderCall call) {
        return simulatedStreaming.replay(complete(call).content());
    }

    private HttpUrl generateUrl(ProviderCall call) {
        return HttpUrl.get(call.descriptor().baseUrl()).newBuilder()
            .addPathSegment(call.model() + ":generateContent")
            .addQueryParameter("key", call.apiKey())
            .build();
    }

    static String redact(HttpUrl url) {
        return url.toString().replaceAll("key=[^&]*", "key=***");
    }
}
