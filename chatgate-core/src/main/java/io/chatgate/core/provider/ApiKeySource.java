package io.chatgate.core.provider;

import java.util.Locale;

/**
 * Looks up a provider's API key at call time. Implementations must never log the value.
 */
@FunctionalInterface
public interface ApiKeySource {

    String apiKey(Provider provider);

    /**
     * Reads {@code OPENAI_API_KEY}, {@code ANTHROPIC_API_KEY} and so on from the process environment.
     */
    static ApiKeySource environment() {
        return provider -> {
            String value = System.getenv(environmentVariable(provider));
            return value == null ? "" : value.trim();
        };
    }

    static String environmentVariable(Provider provider) {
        return provider.key().toUpperCase(Locale.ROOT) + "_API_KEY";
    }
}
