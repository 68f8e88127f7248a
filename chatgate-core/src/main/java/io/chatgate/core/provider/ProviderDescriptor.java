package io.chatgate.core.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one provider: where it lives and which model aliases it knows.
 */
public record ProviderDescriptor(Provider provider, String baseUrl, Map<String, String> modelAliases) {

    public ProviderDescriptor {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        modelAliases = modelAliases == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(modelAliases));
    }

    public ProviderDescriptor withBaseUrl(String overrideUrl) {
        if (overrideUrl == null || overrideUrl.isBlank()) {
            return this;
        }
        return new ProviderDescriptor(provider, overrideUrl, modelAliases);
    }
}
