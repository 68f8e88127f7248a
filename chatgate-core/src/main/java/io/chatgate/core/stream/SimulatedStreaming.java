package io.chatgate.core.stream;

import java.time.Duration;
import java.util.Objects;

/**
 * Pacing used when a provider's full response is replayed as a stream.
 */
public record SimulatedStreaming(Duration delay, Pacer pacer) {
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(50);

    public SimulatedStreaming {
        delay = delay == null || delay.isNegative() ? DEFAULT_DELAY : delay;
        Objects.requireNonNull(pacer, "pacer must not be null");
    }

    public static SimulatedStreaming defaults() {
        return new SimulatedStreaming(DEFAULT_DELAY, Pacer.SLEEP);
    }

    public static SimulatedStreaming withDelay(Duration delay) {
        return new SimulatedStreaming(delay, Pacer.SLEEP);
    }

    public DeltaSource replay(String content) {
        return new SimulatedDeltaSource(content, delay, pacer);
    }
}
