package io.chatgate.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationOptions;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.Turn;
import io.chatgate.core.stream.GenerationStream;
import io.chatgate.core.stream.SimulatedStreaming;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for talking to any registered provider.
 *
 * <p>Both operations resolve the model alias through the {@link ProviderRegistry} and then hand the
 * call to the provider's {@link ProviderAdapter}. An unknown provider name fails with
 * {@link UnsupportedProviderException} before any network I/O. Calls are independent of each other;
 * nothing is retried.
 */
public final class AiGateway {
    private static final Logger LOG = LoggerFactory.getLogger(AiGateway.class);

    private final ProviderRegistry registry;
    private final ApiKeySource apiKeys;
    private final Map<Provider, ProviderAdapter> adapters;

    public AiGateway(ProviderRegistry registry, ApiKeySource apiKeys) {
        this(registry, apiKeys, defaultClient(), SimulatedStreaming.defaults());
    }

    public AiGateway(
        ProviderRegistry registry,
        ApiKeySource apiKeys,
        OkHttpClient client,
        SimulatedStreaming simulatedStreaming
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.apiKeys = Objects.requireNonNull(apiKeys, "apiKeys must not be null");
        Objects.requireNonNull(client, "client must not be null");
        Objects.requireNonNull(simulatedStreaming, "simulatedStreaming must not be null");

        ObjectMapper mapper = new ObjectMapper();
        Map<Provider, ProviderAdapter> table = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            table.put(provider, adapterFor(provider, client, mapper, simulatedStreaming));
        }
        this.adapters = Collections.unmodifiableMap(table);
    }

    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
    }

    public ProviderRegistry registry() {
        return registry;
    }

    /**
     * One synchronous, non-streaming completion.
     */
    public GenerationResult generate(
        String providerKey,
        String modelAlias,
        List<Turn> turns,
        GenerationOptions options
    ) {
        Provider provider = Provider.require(providerKey);
        ProviderCall call = prepare(provider, modelAlias, turns, options);
        LOG.debug(
            "Generating response provider={} model={} api_model={} turns={} images={}",
            provider.key(),
            modelAlias,
            call.model(),
            call.turns().size(),
            call.hasImages()
        );
        try {
            return adapters.get(provider).complete(call);
        } catch (GatewayException e) {
            LOG.warn("Provider {} failed for model {}: {}", provider.key(), call.model(), e.getMessage());
            throw e;
        }
    }

    /**
     * Lazily produced event stream. Nothing is sent to the provider until the caller pulls past
     * {@code Started}; closing the returned stream early releases the connection.
     */
    public GenerationStream generateStreaming(
        String providerKey,
        String modelAlias,
        List<Turn> turns,
        GenerationOptions options
    ) {
        Provider provider = Provider.require(providerKey);
        ProviderCall call = prepare(provider, modelAlias, turns, options);
        ProviderAdapter adapter = adapters.get(provider);
        LOG.debug(
            "Generating streaming response provider={} model={} api_model={} turns={} images={}",
            provider.key(),
            modelAlias,
            call.model(),
            call.turns().size(),
            call.hasImages()
        );
        return new GenerationStream(provider.key(), call.model(), () -> adapter.decodeStream(call));
    }

    private ProviderCall prepare(Provider provider, String modelAlias, List<Turn> turns, GenerationOptions options) {
        Objects.requireNonNull(turns, "turns must not be null");
        String model = registry.resolveModel(provider, modelAlias);
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        String apiKey = apiKeys.apiKey(provider);
        if (apiKey == null || apiKey.isBlank()) {
            LOG.warn("No API key configured for provider {}", provider.key());
        }
        return new ProviderCall(registry.descriptor(provider), model, turns, options, apiKey);
    }

    private static ProviderAdapter adapterFor(
        Provider provider,
        OkHttpClient client,
        ObjectMapper mapper,
        SimulatedStreaming simulatedStreaming
    ) {
        return switch (provider) {
            case OPENAI, DEEPSEEK, MISTRAL -> new OpenAiCompatibleAdapter(provider, client, mapper);
            case ANTHROPIC -> new AnthropicAdapter(client, mapper, simulatedStreaming);
            case GEMINI -> new GeminiAdapter(client, mapper, simulatedStreaming);
        };
    }
}
