package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base", "base_url", "baseUrl"}) String apiBase
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", null);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderConfig[apiKey=" + (configured() ? "***" : "") + ", apiBase=" + apiBase + "]";
    }
}
