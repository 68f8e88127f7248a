package io.chatgate.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.normalize.OpenAiMessageNormalizer;
import io.chatgate.core.response.OpenAiChatResponse;
import io.chatgate.core.stream.DeltaSource;
import io.chatgate.core.stream.SseDeltaSource;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@code POST /chat/completions} with bearer auth and native event streaming. Serves OpenAI, DeepSeek and Mistral.
 */
public final class OpenAiCompatibleAdapter extends AbstractProviderAdapter {

    public OpenAiCompatibleAdapter(Provider provider, OkHttpClient client, ObjectMapper mapper) {
        super(provider, new OpenAiMessageNormalizer(), client, mapper);
    }

    @Override
    public Request buildRequest(ProviderCall call, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", call.model());
        payload.put("messages", normalize(call.turns()));
        payload.put("max_tokens", call.options().maxTokens());
        payload.put("temperature", call.options().temperature());
        payload.put("stream", stream);

        return new Request.Builder()
            .url(completionsUrl(call.descriptor()))
            .post(jsonBody(payload))
            .header("Authorization", "Bearer " + call.apiKey())
            .header("Content-Type", "application/json")
            .header("Accept", stream ? "text/event-stream" : "application/json")
            .build();
    }

    @Override
    public GenerationResult parseFull(String body, String requestedModel) {
        return OpenAiChatResponse.parse(mapper, body).toResult(requestedModel);
    }

    @Override
    public DeltaSource decodeStream(ProviderCall call) throws IOException {
        Response response = client.newCall(buildRequest(call, true)).execute();
        try {
            if (!response.isSuccessful()) {
                String errorBody = response.body() == null ? "" : response.body().string();
                throw new ProviderHttpException(provider(), response.code(), errorBody);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new StreamDecodeException(provider().displayName() + " returned no stream body");
            }
            MediaType contentType = body.contentType();
            if (contentType != null && "json".equalsIgnoreCase(contentType.subtype())) {
                throw new StreamDecodeException(
                    provider().displayName() + " answered a stream request with " + contentType
                );
            }
            return new SseDeltaSource(body.source(), response, mapper);
        } catch (IOException | RuntimeException e) {
            response.close();
            throw e;
        }
    }

    private HttpUrl completionsUrl(ProviderDescriptor descriptor) {
        return HttpUrl.get(descriptor.baseUrl()).newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }
}
