package com.ruteberegner.distance.infrastructure.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
