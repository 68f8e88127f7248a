package io.chatgate.core.config;

import io.chatgate.core.config.model.ChatgateConfig;
import io.chatgate.core.config.model.ProviderConfig;
import io.chatgate.core.provider.ApiKeySource;
import io.chatgate.core.provider.Provider;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Key from the config file, falling back to the {@code <PROVIDER>_API_KEY} environment variable.
 */
public final class ConfigApiKeySource implements ApiKeySource {
    private final Supplier<ChatgateConfig> config;
    private final ApiKeySource fallback;

    public ConfigApiKeySource(Supplier<ChatgateConfig> config) {
        this(config, ApiKeySource.environment());
    }

    public ConfigApiKeySource(Supplier<ChatgateConfig> config, ApiKeySource fallback) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    @Override
    public String apiKey(Provider provider) {
        ChatgateConfig current = config.get();
        ProviderConfig providerConfig = current == null || current.providers() == null
            ? ProviderConfig.defaults()
            : current.providers().forProvider(provider);
        if (providerConfig.configured()) {
            return providerConfig.apiKey().trim();
        }
        String fromFallback = fallback.apiKey(provider);
        return fromFallback == null ? "" : fromFallback;
    }
}
