package com.braid.core.engine;

import java.time.Duration;

/**
 * Blocking pause between polls. Implementations must respond to thread interruption.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
