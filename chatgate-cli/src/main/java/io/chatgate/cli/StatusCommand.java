package io.chatgate.cli;

import io.chatgate.core.config.ConfigPaths;
import io.chatgate.core.config.model.ChatgateConfig;
import io.chatgate.core.provider.ApiKeySource;
import io.chatgate.core.provider.Provider;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChatgateConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Server: " + config.server().host() + ":" + config.server().port());
            System.out.println("Conversation store: " + ConfigPaths.expand(config.storage().sqlitePath()));
            System.out.println("Simulated stream delay: " + config.streaming().simulatedDelayMs() + " ms");
            for (Provider provider : Provider.values()) {
                String key = context.apiKeys().apiKey(provider);
                boolean configured = key != null && !key.isBlank();
                System.out.println(provider.displayName() + " configured: " + configured
                    + (configured ? "" : " (set " + ApiKeySource.environmentVariable(provider) + ")"));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
