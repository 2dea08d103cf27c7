package com.optiontracker.calculation;

import java.time.Duration;

/**
 * Waits between retry attempts. Injected so tests can run the retry loop without sleeping.
 */
@FunctionalInterface
public interface RetryDelayer {

    void await(Duration delay) throws InterruptedException;

    static RetryDelayer sleeping() {
        return delay -> Thread.sleep(delay.toMillis());
    }
}
