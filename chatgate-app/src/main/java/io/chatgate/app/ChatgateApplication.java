package io.chatgate.app;

import io.chatgate.cli.ChatCommand;
import io.chatgate.cli.ChatgateCliCommand;
import io.chatgate.cli.CliContext;
import io.chatgate.cli.InitCommand;
import io.chatgate.cli.ModelsCommand;
import io.chatgate.cli.ServeCommand;
import io.chatgate.cli.StatusCommand;
import io.chatgate.core.api.GatewayServer;
import io.chatgate.core.config.ConfigApiKeySource;
import io.chatgate.core.config.ConfigPaths;
import io.chatgate.core.config.ConfigService;
import io.chatgate.core.config.model.ChatgateConfig;
import io.chatgate.core.provider.AiGateway;
import io.chatgate.core.provider.ApiKeySource;
import io.chatgate.core.provider.ProviderRegistry;
import io.chatgate.core.session.ConversationStore;
import io.chatgate.core.session.InMemoryConversationStore;
import io.chatgate.core.session.SqliteConversationStore;
import io.chatgate.core.stream.SimulatedStreaming;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ChatgateApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ChatgateApplication.class);

    private ChatgateApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ChatgateConfig config = loadConfig(configService, configPath);

        ProviderRegistry registry = ProviderRegistry.withBaseUrls(config.providers().baseUrlOverrides());
        ApiKeySource apiKeys = new ConfigApiKeySource(() -> config);
        SimulatedStreaming simulatedStreaming = SimulatedStreaming.withDelay(
            Duration.ofMillis(Math.max(0, config.streaming().simulatedDelayMs()))
        );
        AiGateway gateway = new AiGateway(registry, apiKeys, AiGateway.defaultClient(), simulatedStreaming);

        CliContext context = new CliContext(
            gateway,
            apiKeys,
            configService,
            configPath,
            portOverride -> runServer(config, gateway, portOverride)
        );

        CommandLine commandLine = new CommandLine(new ChatgateCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static ChatgateConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read config {}, using defaults: {}", configPath, e.getMessage());
            return ChatgateConfig.defaults();
        }
    }

    private static ConversationStore buildConversationStore(ChatgateConfig config) {
        String backend = System.getenv().getOrDefault("CHATGATE_CONVERSATION_STORE", "sqlite").trim().toLowerCase();
        if ("memory".equals(backend)) {
            return new InMemoryConversationStore();
        }
        Path sqlitePath = ConfigPaths.expand(config.storage().sqlitePath());
        try {
            return new SqliteConversationStore(sqlitePath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite conversation store at " + sqlitePath, e);
        }
    }

    private static int runServer(ChatgateConfig config, AiGateway gateway, Integer portOverride) throws Exception {
        int port = portOverride != null ? portOverride : config.server().port();
        ConversationStore store = buildConversationStore(config);

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            port,
            config.server().host(),
            config.server().apiToken(),
            gateway,
            store
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: GET /chat/models, GET /chat/health, POST /conversations, "
                + "GET|POST /conversations/{id}/messages, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
