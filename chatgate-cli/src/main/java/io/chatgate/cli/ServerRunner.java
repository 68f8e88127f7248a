package io.chatgate.cli;

@FunctionalInterface
public interface ServerRunner {
    /**
     * Runs the HTTP gateway until shutdown. A {@code null} port means the configured one.
     */
    int run(Integer portOverride) throws Exception;
}
