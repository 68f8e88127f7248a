package io.chatgate.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.Turn;
import io.chatgate.core.normalize.MessageNormalizer;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public abstract class AbstractProviderAdapter implements ProviderAdapter {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final Provider provider;
    private final MessageNormalizer normalizer;
    protected final OkHttpClient client;
    protected final ObjectMapper mapper;

    protected AbstractProviderAdapter(
        Provider provider,
        MessageNormalizer normalizer,
        OkHttpClient client,
        ObjectMapper mapper
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Provider provider() {
        return provider;
    }

    @Override
    public List<Map<String, Object>> normalize(List<Turn> turns) {
        return normalizer.normalize(turns);
    }

    @Override
    public GenerationResult complete(ProviderCall call) {
        Request request = buildRequest(call, false);
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new ProviderHttpException(provider, response.code(), body);
            }
            return parseFull(body, call.model());
        } catch (IOException e) {
            throw new ProviderTransportException(provider, e);
        }
    }

    protected RequestBody jsonBody(Map<String, Object> payload) {
        try {
            return RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + provider.key() + " request", e);
        }
    }
}
