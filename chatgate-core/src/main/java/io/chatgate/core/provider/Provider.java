package io.chatgate.core.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of LLM vendors the gateway can talk to, in registration order.
 */
public enum Provider {
    OPENAI("openai", "OpenAI"),
    ANTHROPIC("anthropic", "Anthropic"),
    DEEPSEEK("deepseek", "DeepSeek"),
    GEMINI("gemini", "Gemini"),
    MISTRAL("mistral", "Mistral");

    private final String key;
    private final String displayName;

    Provider(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<Provider> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.key.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    public static Provider require(String key) {
        return fromKey(key).orElseThrow(() -> new UnsupportedProviderException(key));
    }
}
