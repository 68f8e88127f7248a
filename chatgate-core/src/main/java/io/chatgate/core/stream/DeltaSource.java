package io.chatgate.core.stream;

import java.io.IOException;
import java.util.Optional;

/**
 * Pull-based sequence of text deltas. Consumed once; {@link #close()} releases whatever backs it.
 */
public interface DeltaSource extends AutoCloseable {

    /**
     * Next delta, or empty once the source is exhausted.
     */
    Optional<String> next() throws IOException;

    @Override
    void close();
}
