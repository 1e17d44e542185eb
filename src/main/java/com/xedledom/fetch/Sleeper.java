package com.xedledom.fetch;

import java.time.Duration;

/**
 * Pauses the calling thread. Swapped out in tests to observe pauses without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
