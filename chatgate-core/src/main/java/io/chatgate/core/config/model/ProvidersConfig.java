package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chatgate.core.provider.Provider;
import java.util.EnumMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig anthropic,
    ProviderConfig deepseek,
    ProviderConfig gemini,
    ProviderConfig mistral
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }

    public ProviderConfig forProvider(Provider provider) {
        ProviderConfig config = switch (provider) {
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
            case DEEPSEEK -> deepseek;
            case GEMINI -> gemini;
            case MISTRAL -> mistral;
        };
        return config == null ? ProviderConfig.defaults() : config;
    }

    /**
     * Configured {@code apiBase} values, for providers that set one.
     */
    public Map<Provider, String> baseUrlOverrides() {
        Map<Provider, String> overrides = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            String apiBase = forProvider(provider).apiBase();
            if (apiBase != null && !apiBase.isBlank()) {
                overrides.put(provider, apiBase.trim());
            }
        }
        return overrides;
    }
}
