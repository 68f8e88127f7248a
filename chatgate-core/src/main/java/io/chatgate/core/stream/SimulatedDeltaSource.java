package io.chatgate.core.stream;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Replays a finished completion as a paced word stream for providers without incremental delivery.
 * The text is split on single spaces and every token is emitted with a trailing space.
 */
public final class SimulatedDeltaSource implements DeltaSource {
    private final String[] tokens;
    private final Duration pacing;
    private final Pacer pacer;
    private int position;
    private boolean closed;

    public SimulatedDeltaSource(String content, Duration pacing, Pacer pacer) {
        this.tokens = (content == null ? "" : content).split(" ", -1);
        this.pacing = pacing == null || pacing.isNegative() ? Duration.ZERO : pacing;
        this.pacer = Objects.requireNonNull(pacer, "pacer must not be null");
    }

    @Override
    public Optional<String> next() throws InterruptedIOException {
        if (closed || position >= tokens.length) {
            return Optional.empty();
        }
        if (position > 0 && !pacing.isZero()) {
            try {
                pacer.pause(pacing);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("simulated stream interrupted");
            }
        }
        return Optional.of(tokens[position++] + " ");
    }

    @Override
    public void close() {
        closed = true;
    }
}
