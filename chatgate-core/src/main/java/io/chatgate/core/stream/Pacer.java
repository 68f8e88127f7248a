package io.chatgate.core.stream;

import java.time.Duration;

@FunctionalInterface
public interface Pacer {
    Pacer SLEEP = delay -> Thread.sleep(delay.toMillis());

    void pause(Duration delay) throws InterruptedException;
}
