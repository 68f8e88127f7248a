package io.chatgate.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.GenerationOptions;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.Turn;
import io.chatgate.core.stream.SimulatedStreaming;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GeminiAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private GeminiAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        adapter = new GeminiAdapter(new OkHttpClient(), mapper, new SimulatedStreaming(Duration.ZERO, delay -> { }));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCallModelEndpointWithKeyInQuery() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "candidates": [ { "content": { "role": "model", "parts": [ { "text": "hi there" } ] } } ],
                  "usageMetadata": { "totalTokenCount": 7 }
                }
                """));

        GenerationResult result = adapter.complete(call(List.of(Turn.user("hi"), Turn.assistant("hello"), Turn.user("again"))));

        assertThat(result.content()).isEqualTo("hi there");
        assertThat(result.model()).isEqualTo("gemini-1.5-flash");
        assertThat(result.usage()).containsEntry("totalTokenCount", 7);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v1beta/models/gemini-1.5-flash:generateContent");
        assertThat(request.getRequestUrl().queryParameter("key")).isEqualTo("g-key");
        assertThat(request.getHeader("Authorization")).isNull();
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("contents")).hasSize(3);
        assertThat(body.path("contents").get(1).path("role").asText()).isEqualTo("model");
        assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(1000);
        assertThat(body.path("generationConfig").path("temperature").asDouble()).isEqualTo(0.7);
    }

    @Test
    void shouldRedactKeyForLogging() {
        HttpUrl url = HttpUrl.get("https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash:generateContent?key=secret-123");

        assertThat(GeminiAdapter.redact(url))
            .doesNotContain("secret-123")
            .endsWith("key=***");
    }

    private ProviderCall call(List<Turn> turns) {
        ProviderDescriptor descriptor = ProviderRegistry.defaults()
            .descriptor(Provider.GEMINI)
            .withBaseUrl(server.url("/v1beta/models").toString());
        return new ProviderCall(descriptor, "gemini-1.5-flash", turns, GenerationOptions.defaults(), "g-key");
    }
}
