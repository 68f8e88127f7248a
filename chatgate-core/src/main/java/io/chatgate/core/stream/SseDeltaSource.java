package io.chatgate.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a chat-completions event stream line by line. Only {@code data: } lines count,
 * {@code [DONE]} ends the stream and lines that are not JSON are skipped.
 */
public final class SseDeltaSource implements DeltaSource {
    private static final Logger LOG = LoggerFactory.getLogger(SseDeltaSource.class);
    static final String DATA_PREFIX = "data: ";
    static final String DONE_SENTINEL = "[DONE]";

    private final BufferedSource source;
    private final Closeable owner;
    private final ObjectMapper mapper;
    private boolean finished;

    public SseDeltaSource(BufferedSource source, Closeable owner, ObjectMapper mapper) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.owner = owner == null ? source : owner;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<String> next() throws IOException {
        while (!finished) {
            String line = source.readUtf8Line();
            if (line == null) {
                close();
                break;
            }
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }

            String payload = line.substring(DATA_PREFIX.length());
            if (DONE_SENTINEL.equals(payload)) {
                close();
                break;
            }

            Optional<String> delta = parseDelta(payload);
            if (delta.isPresent()) {
                return delta;
            }
        }
        return Optional.empty();
    }

    private Optional<String> parseDelta(String payload) {
        JsonNode event;
        try {
            event = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping undecodable stream line: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (event == null) {
            return Optional.empty();
        }
        JsonNode content = event.path("choices").path(0).path("delta").path("content");
        if (!content.isTextual() || content.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(content.asText());
    }

    @Override
    public void close() {
        if (finished) {
            return;
        }
        finished = true;
        try {
            owner.close();
        } catch (IOException e) {
            LOG.debug("Failed to release stream body: {}", e.getMessage());
        }
    }
}
