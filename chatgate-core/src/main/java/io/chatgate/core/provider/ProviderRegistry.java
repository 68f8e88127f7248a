package io.chatgate.core.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of providers and their model aliases. Built once at startup and shared.
 */
public final class ProviderRegistry {
    private final Map<Provider, ProviderDescriptor> descriptors;

    private ProviderRegistry(Map<Provider, ProviderDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new EnumMap<>(descriptors));
    }

    public static ProviderRegistry defaults() {
        return withBaseUrls(Map.of());
    }

    /**
     * Default catalogue with the given base URLs replacing the built-in ones.
     */
    public static ProviderRegistry withBaseUrls(Map<Provider, String> baseUrlOverrides) {
        Map<Provider, ProviderDescriptor> table = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            ProviderDescriptor descriptor = defaultDescriptor(provider);
            String override = baseUrlOverrides == null ? null : baseUrlOverrides.get(provider);
            table.put(provider, descriptor.withBaseUrl(override));
        }
        return new ProviderRegistry(table);
    }

    public ProviderDescriptor descriptor(Provider provider) {
        return descriptors.get(provider);
    }

    public Optional<ProviderDescriptor> find(String providerKey) {
        return Provider.fromKey(providerKey).map(descriptors::get);
    }

    /**
     * Maps an alias to the literal model id. Literal ids and unknown names pass through unchanged.
     */
    public String resolveModel(String providerKey, String alias) {
        Map<String, String> models = modelCatalog(providerKey);
        if (models.containsValue(alias)) {
            return alias;
        }
        return models.getOrDefault(alias, alias);
    }

    public String resolveModel(Provider provider, String alias) {
        return resolveModel(provider.key(), alias);
    }

    public List<String> listProviders() {
        List<String> names = new ArrayList<>();
        for (Provider provider : descriptors.keySet()) {
            names.add(provider.key());
        }
        return List.copyOf(names);
    }

    /**
     * Alias keys for openai and anthropic, literal ids for everyone else, nothing for unknown providers.
     */
    public List<String> listModelAliases(String providerKey) {
        Optional<Provider> provider = Provider.fromKey(providerKey);
        if (provider.isEmpty()) {
            return List.of();
        }
        Map<String, String> models = descriptors.get(provider.get()).modelAliases();
        return switch (provider.get()) {
            case OPENAI, ANTHROPIC -> List.copyOf(models.keySet());
            case DEEPSEEK, GEMINI, MISTRAL -> List.copyOf(new LinkedHashSet<>(models.values()));
        };
    }

    public Map<String, String> modelCatalog(String providerKey) {
        return find(providerKey).map(ProviderDescriptor::modelAliases).orElse(Map.of());
    }

    private static ProviderDescriptor defaultDescriptor(Provider provider) {
        Map<String, String> models = new LinkedHashMap<>();
        String baseUrl;
        switch (provider) {
            case OPENAI -> {
                baseUrl = "https://api.openai.com/v1";
                identity(models, "gpt-4o", "gpt-4o-mini", "gpt-4-turbo", "gpt-4", "gpt-3.5-turbo");
            }
            case ANTHROPIC -> {
                baseUrl = "https://api.anthropic.com/v1";
                models.put("claude-opus-4", "claude-opus-4-20250514");
                models.put("claude-sonnet-4", "claude-sonnet-4-20250514");
                models.put("claude-3-7-sonnet", "claude-3-7-sonnet-20250219");
                models.put("claude-3-5-sonnet", "claude-3-5-sonnet-20241022");
                models.put("claude-3-5-haiku", "claude-3-5-haiku-20241022");
                models.put("claude-3-opus", "claude-3-opus-20240229");
                models.put("claude-3-sonnet", "claude-3-sonnet-20240229");
                models.put("claude-3-haiku", "claude-3-haiku-20240307");
            }
            case DEEPSEEK -> {
                baseUrl = "https://api.deepseek.com/v1";
                identity(models, "deepseek-chat");
            }
            case GEMINI -> {
                baseUrl = "https://generativelanguage.googleapis.com/v1beta/models";
                identity(
                    models,
                    "gemini-1.5-flash",
                    "gemini-2.0-flash-exp",
                    "gemini-2.0-flash-lite-exp",
                    "gemini-2.0-flash-lite-preview-02-05",
                    "gemini-2.0-flash"
                );
            }
            case MISTRAL -> {
                baseUrl = "https://api.mistral.ai/v1";
                identity(models, "mistral-large-latest");
            }
            default -> throw new IllegalStateException("No catalogue for " + provider);
        }
        return new ProviderDescriptor(provider, baseUrl, models);
    }

    private static void identity(Map<String, String> models, String... ids) {
        for (String id : ids) {
            models.put(id, id);
        }
    }
}
