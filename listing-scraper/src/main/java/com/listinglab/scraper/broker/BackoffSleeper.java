package com.listinglab.scraper.broker;

import java.time.Duration;

/**
 * Waits between broker connection attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
