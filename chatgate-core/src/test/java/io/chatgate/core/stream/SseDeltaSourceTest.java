package io.chatgate.core.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import okio.Buffer;
import org.junit.jupiter.api.Test;

class SseDeltaSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldEmitSingleChunkAndStopAtDone() throws IOException {
        Buffer body = new Buffer().writeUtf8("data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\ndata: [DONE]\n\n");
        SseDeltaSource source = new SseDeltaSource(body, null, mapper);

        assertThat(source.next()).contains("Hi");
        assertThat(source.next()).isEmpty();
        assertThat(source.next()).isEmpty();
    }

    @Test
    void shouldIgnoreEverythingAfterDone() throws IOException {
        Buffer body = new Buffer().writeUtf8("""
            data: [DONE]

            data: {"choices":[{"delta":{"content":"late"}}]}

            """);

        assertThat(drain(new SseDeltaSource(body, null, mapper))).isEmpty();
    }

    @Test
    void shouldSkipMalformedLinesCommentsAndEmptyDeltas() throws IOException {
        Buffer body = new Buffer().writeUtf8("""
            : keep-alive
            event: message
            data: {"choices":[{"delta":{"role":"assistant"}}]}

            data: {"choices":[{"delta":{"content":""}}]}

            data: {not json

            data: {"choices":[{"delta":{"content":"Hello"}}]}

            data:{"choices":[{"delta":{"content":"no space after colon"}}]}

            data: {"choices":[{"delta":{"content":" world"}}]}

            data: [DONE]
            """);

        assertThat(drain(new SseDeltaSource(body, null, mapper))).containsExactly("Hello", " world");
    }

    @Test
    void shouldEndWhenBodyEndsWithoutDone() throws IOException {
        Buffer body = new Buffer().writeUtf8("data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}\n");

        assertThat(drain(new SseDeltaSource(body, null, mapper))).containsExactly("partial");
    }

    @Test
    void shouldCloseOwnerOnceAndStopProducing() throws IOException {
        int[] closes = {0};
        Buffer body = new Buffer().writeUtf8("data: {\"choices\":[{\"delta\":{\"content\":\"a\"}}]}\n\n");
        SseDeltaSource source = new SseDeltaSource(body, () -> closes[0]++, mapper);

        source.close();
        source.close();

        assertThat(closes[0]).isEqualTo(1);
        assertThat(source.next()).isEqualTo(Optional.empty());
    }

    private static List<String> drain(DeltaSource source) throws IOException {
        List<String> chunks = new ArrayList<>();
        Optional<String> next = source.next();
        while (next.isPresent()) {
            chunks.add(next.get());
            next = source.next();
        }
        return chunks;
    }
}
