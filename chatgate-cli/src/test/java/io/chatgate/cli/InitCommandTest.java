package io.chatgate.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.chatgate.core.config.ConfigService;
import io.chatgate.core.provider.AiGateway;
import io.chatgate.core.provider.Provider;
import io.chatgate.core.provider.ProviderRegistry;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class InitCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateThenOverwriteConfig() throws Exception {
        CliContext context = context(tempDir.resolve("chatgate/config.json"));

        assertThat(capture(() -> new CommandLine(new InitCommand(context)).execute())).startsWith("Created config:");
        assertThat(Files.readString(context.configPath())).contains("\"port\" : 8787");
        assertThat(capture(() -> new CommandLine(new InitCommand(context)).execute())).startsWith("Refreshed config");
        assertThat(capture(() -> new CommandLine(new InitCommand(context)).execute("--overwrite"))).startsWith("Overwrote config");
    }

    @Test
    void statusShouldReportWhichProvidersHaveKeys() {
        CliContext context = new CliContext(
            new AiGateway(ProviderRegistry.defaults(), provider -> ""),
            provider -> provider == Provider.GEMINI ? "g-key" : "",
            new ConfigService(),
            tempDir.resolve("missing.json")
        );

        String out = capture(() -> new CommandLine(new StatusCommand(context)).execute());

        assertThat(out)
            .contains("Config exists: false")
            .contains("Gemini configured: true")
            .contains("OpenAI configured: false (set OPENAI_API_KEY)");
    }

    @Test
    void modelsShouldListAliasesWithLiteralIds() {
        CliContext context = context(tempDir.resolve("config.json"));

        String out = capture(() -> new CommandLine(new ModelsCommand(context)).execute());

        assertThat(out)
            .contains("openai (https://api.openai.com/v1)")
            .contains("  gpt-4o")
            .contains("claude-3-opus -> claude-3-opus-20240229")
            .contains("  deepseek-chat");
    }

    private static CliContext context(Path configPath) {
        return new CliContext(
            new AiGateway(ProviderRegistry.defaults(), provider -> ""),
            provider -> "",
            new ConfigService(),
            configPath
        );
    }

    private static String capture(Runnable action) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
