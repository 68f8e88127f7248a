package io.chatgate.core.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.chatgate.core.model.ErrorKind;
import io.chatgate.core.model.StreamEvent;
import io.chatgate.core.provider.Provider;
import io.chatgate.core.provider.ProviderHttpException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class GenerationStreamTest {

    @Test
    void shouldEmitStartedChunksAndCompleted() {
        FakeSource source = new FakeSource("Hel", "lo");
        GenerationStream stream = new GenerationStream("openai", "gpt-4o", () -> source);

        List<StreamEvent> events = stream.toStream().collect(Collectors.toList());

        assertThat(events).containsExactly(
            new StreamEvent.Started("gpt-4o", "openai"),
            new StreamEvent.Chunk("Hel"),
            new StreamEvent.Chunk("lo"),
            new StreamEvent.Completed("Hello", "gpt-4o")
        );
        assertThat(stream.hasNext()).isFalse();
        assertThat(source.closed).isTrue();
    }

    @Test
    void shouldNotOpenProviderCallBeforeSecondPull() {
        int[] opens = {0};
        GenerationStream stream = new GenerationStream("anthropic", "claude-3-haiku-20240307", () -> {
            opens[0]++;
            return new FakeSource();
        });

        assertThat(stream.next()).isInstanceOf(StreamEvent.Started.class);
        assertThat(opens[0]).isZero();

        assertThat(stream.next()).isEqualTo(new StreamEvent.Completed("", "claude-3-haiku-20240307"));
        assertThat(opens[0]).isEqualTo(1);
    }

    @Test
    void shouldFailExactlyOnceWhenConnectionDropsAfterFirstChunk() {
        FakeSource source = new FakeSource("Hi");
        source.failAfterChunks = new IOException("connection reset");
        GenerationStream stream = new GenerationStream("openai", "gpt-4o", () -> source);

        List<StreamEvent> events = stream.toStream().collect(Collectors.toList());

        assertThat(events).hasSize(3);
        assertThat(events.get(1)).isEqualTo(new StreamEvent.Chunk("Hi"));
        assertThat(events.get(2)).isEqualTo(new StreamEvent.Failed(ErrorKind.TRANSPORT, "connection reset"));
        assertThat(events).noneMatch(event -> event instanceof StreamEvent.Completed);
        assertThat(source.closed).isTrue();
    }

    @Test
    void shouldReportProviderErrorKindWhenOpeningFails() {
        GenerationStream stream = new GenerationStream("mistral", "mistral-large-latest", () -> {
            throw new ProviderHttpException(Provider.MISTRAL, 429, "{\"message\":\"rate limited\"}");
        });

        stream.next();
        StreamEvent terminal = stream.next();

        assertThat(terminal).isInstanceOf(StreamEvent.Failed.class);
        assertThat(((StreamEvent.Failed) terminal).errorKind()).isEqualTo(ErrorKind.PROVIDER_HTTP);
        assertThat(((StreamEvent.Failed) terminal).message()).contains("HTTP 429");
        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldReleaseSourceWhenClosedEarly() {
        FakeSource source = new FakeSource("a", "b", "c");
        GenerationStream stream = new GenerationStream("openai", "gpt-4o", () -> source);

        stream.next();
        stream.next();
        stream.close();

        assertThat(source.closed).isTrue();
        assertThat(stream.hasNext()).isFalse();
        assertThat(stream.text()).isEqualTo("a");
    }

    @Test
    void shouldNotRestart() {
        GenerationStream stream = new GenerationStream("openai", "gpt-4o", FakeSource::new);
        stream.toStream().forEach(event -> { });

        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }

    private static final class FakeSource implements DeltaSource {
        private final Deque<String> chunks;
        IOException failAfterChunks;
        boolean closed;

        FakeSource(String... chunks) {
            this.chunks = new ArrayDeque<>(List.of(chunks));
        }

        @Override
        public Optional<String> next() throws IOException {
            if (!chunks.isEmpty()) {
                return Optional.of(chunks.poll());
            }
            if (failAfterChunks != null) {
                throw failAfterChunks;
            }
            return Optional.empty();
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
