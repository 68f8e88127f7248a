package io.chatgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatgateConfig(
    ServerConfig server,
    ProvidersConfig providers,
    StreamingConfig streaming,
    StorageConfig storage
) {

    public static ChatgateConfig defaults() {
        return new ChatgateConfig(
            ServerConfig.defaults(),
            ProvidersConfig.defaults(),
            StreamingConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
