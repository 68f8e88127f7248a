package io.chatgate.core.stream;

import io.chatgate.core.model.ErrorKind;
import io.chatgate.core.model.StreamEvent;
import io.chatgate.core.provider.GatewayException;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily produced events of one streaming generation.
 *
 * <p>The first pull yields {@link StreamEvent.Started} without touching the network; the provider
 * call happens on the second pull. Every later pull reads just enough to produce one event. Once a
 * {@link StreamEvent.Completed} or {@link StreamEvent.Failed} has been returned the stream is over.
 * Closing before that releases the underlying connection and ends the stream without a terminal event.
 * Not restartable and not thread-safe.
 */
public final class GenerationStream implements Iterator<StreamEvent>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GenerationStream.class);

    private enum State {
        IDLE,
        STARTED,
        DONE
    }

    private final String provider;
    private final String model;
    private final DeltaSourceFactory factory;
    private final StringBuilder text = new StringBuilder();
    private DeltaSource source;
    private State state = State.IDLE;

    public GenerationStream(String provider, String model, DeltaSourceFactory factory) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }

    @Override
    public boolean hasNext() {
        return state != State.DONE;
    }

    @Override
    public StreamEvent next() {
        switch (state) {
            case IDLE -> {
                state = State.STARTED;
                return new StreamEvent.Started(model, provider);
            }
            case STARTED -> {
                return pull();
            }
            default -> throw new NoSuchElementException("stream already terminated");
        }
    }

    private StreamEvent pull() {
        try {
            if (source == null) {
                source = factory.open();
            }
            Optional<String> delta = source.next();
            if (delta.isPresent()) {
                text.append(delta.get());
                return new StreamEvent.Chunk(delta.get());
            }
            return terminate(new StreamEvent.Completed(text.toString(), model));
        } catch (GatewayException e) {
            LOG.warn("Stream from {} ({}) failed: {}", provider, model, e.getMessage());
            return terminate(new StreamEvent.Failed(e.kind(), e.getMessage()));
        } catch (IOException e) {
            LOG.warn("Stream from {} ({}) lost its connection: {}", provider, model, e.getMessage());
            return terminate(new StreamEvent.Failed(ErrorKind.TRANSPORT, describe(e)));
        } catch (RuntimeException e) {
            LOG.warn("Stream from {} ({}) failed unexpectedly", provider, model, e);
            return terminate(new StreamEvent.Failed(ErrorKind.STREAM_DECODE, describe(e)));
        }
    }

    private StreamEvent terminate(StreamEvent terminal) {
        state = State.DONE;
        release();
        return terminal;
    }

    /**
     * Text received so far.
     */
    public String text() {
        return text.toString();
    }

    public Stream<StreamEvent> toStream() {
        Spliterator<StreamEvent> spliterator = Spliterators.spliteratorUnknownSize(
            this,
            Spliterator.ORDERED | Spliterator.NONNULL
        );
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    @Override
    public void close() {
        if (state != State.DONE) {
            LOG.debug("Stream from {} ({}) abandoned by consumer", provider, model);
        }
        state = State.DONE;
        release();
    }

    private void release() {
        if (source != null) {
            source.close();
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    /**
     * Opens the provider call backing a stream. Invoked at most once, on the pull after {@code Started}.
     */
    @FunctionalInterface
    public interface DeltaSourceFactory {
        DeltaSource open() throws IOException;
    }
}
