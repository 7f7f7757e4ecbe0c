package io.clipboardstore.spi;

import java.time.Duration;

/**
 * Sleep used between lock polls.
 */
@FunctionalInterface
public interface Pause {

    void sleep(Duration duration) throws InterruptedException;

    static Pause threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
