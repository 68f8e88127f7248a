package io.chatgate.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.config.ConfigService;
import io.chatgate.core.provider.AiGateway;
import io.chatgate.core.provider.Provider;
import io.chatgate.core.provider.ProviderRegistry;
import io.chatgate.core.stream.SimulatedStreaming;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ChatCommandIntegrationTest {

    private MockWebServer server;
    private CliContext context;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ProviderRegistry registry = ProviderRegistry.withBaseUrls(Map.of(
            Provider.OPENAI, server.url("/v1").toString(),
            Provider.ANTHROPIC, server.url("/anthropic").toString()
        ));
        AiGateway gateway = new AiGateway(
            registry,
            provider -> "sk-test",
            new OkHttpClient(),
            new SimulatedStreaming(Duration.ZERO, delay -> { })
        );
        context = new CliContext(gateway, provider -> "sk-test", new ConfigService(), tempDir.resolve("config.json"));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPrintReplyFromProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "integration-ok" } }
                  ]
                }
                """));

        CommandResult result = run("hello", "-s", "be brief", "--temperature", "0.3");

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("integration-ok");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.3);
    }

    @Test
    void shouldStreamSimulatedChunksAndAttachImage() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                { "model": "claude-3-5-haiku-20241022", "content": [ { "type": "text", "text": "a small square" } ] }
                """));
        Path image = tempDir.resolve("dot.png");
        Files.write(image, new byte[] {(byte) 0x89, 'P', 'N', 'G'});

        CommandResult result = run("describe", "-p", "anthropic", "-m", "claude-3-5-haiku", "--stream", "--image", image.toString());

        assertThat(result.code()).isZero();
        assertThat(result.out()).contains("a small square");
        String sent = server.takeRequest().getBody().readUtf8();
        assertThat(sent).contains("\"media_type\":\"image/png\"");
    }

    @Test
    void shouldFailForUnknownProvider() {
        CommandResult result = run("hello", "-p", "cohere");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Chat command failed");
        assertThat(server.getRequestCount()).isZero();
    }

    private CommandResult run(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = new CommandLine(new ChatCommand(context)).execute(args);
            return new CommandResult(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record CommandResult(int code, String out, String err) {
    }
}
