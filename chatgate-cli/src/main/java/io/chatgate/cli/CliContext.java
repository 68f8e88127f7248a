package io.chatgate.cli;

import io.chatgate.core.config.ConfigService;
import io.chatgate.core.provider.AiGateway;
import io.chatgate.core.provider.ApiKeySource;
import java.nio.file.Path;

public record CliContext(
    AiGateway gateway,
    ApiKeySource apiKeys,
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner
) {
    public CliContext(AiGateway gateway, ApiKeySource apiKeys, ConfigService configService, Path configPath) {
        this(gateway, apiKeys, configService, configPath, portOverride -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }
}
