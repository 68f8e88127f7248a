package io.chatgate.core.model;

/**
 * Events of one streaming generation. A stream yields exactly one {@link Started},
 * any number of {@link Chunk}s and then exactly one {@link Completed} or {@link Failed}.
 */
public sealed interface StreamEvent
    permits StreamEvent.Started, StreamEvent.Chunk, StreamEvent.Completed, StreamEvent.Failed {

    default boolean terminal() {
        return false;
    }

    record Started(String model, String provider) implements StreamEvent {
    }

    record Chunk(String text) implements StreamEvent {
    }

    record Completed(String finalText, String model) implements StreamEvent {
        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Failed(ErrorKind errorKind, String message) implements StreamEvent {
        @Override
        public boolean terminal() {
            return true;
        }
    }
}
