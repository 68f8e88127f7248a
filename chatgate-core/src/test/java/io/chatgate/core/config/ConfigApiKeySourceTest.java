package io.chatgate.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.config.model.ChatgateConfig;
import io.chatgate.core.config.model.ProviderConfig;
import io.chatgate.core.config.model.ProvidersConfig;
import io.chatgate.core.provider.ApiKeySource;
import io.chatgate.core.provider.Provider;
import org.junit.jupiter.api.Test;

class ConfigApiKeySourceTest {

    @Test
    void shouldPreferConfiguredKeyAndFallBackOtherwise() {
        ProvidersConfig providers = new ProvidersConfig(
            new ProviderConfig(" sk-openai ", null),
            null,
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
        ChatgateConfig defaults = ChatgateConfig.defaults();
        ChatgateConfig config = new ChatgateConfig(defaults.server(), providers, defaults.streaming(), defaults.storage());
        ApiKeySource source = new ConfigApiKeySource(() -> config, provider -> "env-" + provider.key());

        assertThat(source.apiKey(Provider.OPENAI)).isEqualTo("sk-openai");
        assertThat(source.apiKey(Provider.ANTHROPIC)).isEqualTo("env-anthropic");
        assertThat(source.apiKey(Provider.GEMINI)).isEqualTo("env-gemini");
    }

    @Test
    void shouldNameEnvironmentVariables() {
        assertThat(ApiKeySource.environmentVariable(Provider.DEEPSEEK)).isEqualTo("DEEPSEEK_API_KEY");
        assertThat(ApiKeySource.environmentVariable(Provider.GEMINI)).isEqualTo("GEMINI_API_KEY");
    }
}
