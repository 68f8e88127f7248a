package io.chatgate.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Writes named server-sent events ({@code event:} line, one JSON {@code data:} line, blank line),
 * flushing after each so the client sees them immediately.
 */
final class SseEventWriter {
    private final OutputStream out;
    private final ObjectMapper mapper;

    SseEventWriter(OutputStream out, ObjectMapper mapper) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    void send(String event, Map<String, ?> data) throws IOException {
        String frame = "event: " + event + "\n"
            + "data: " + mapper.writeValueAsString(data) + "\n\n";
        out.write(frame.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
