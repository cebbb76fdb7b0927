package com.ruteberegner.distance.infrastructure.retry;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter around a single fallible call.
 *
 * <p>A failure accepted by the {@code retryable} predicate is followed by a sleep of
 * {@code min(delay + jitter, maxDelay)}, where jitter is drawn from [10%, 30%] of
 * {@code delay}; the delay then doubles up to {@code maxDelay}. Any other failure,
 * or a retryable one on the last attempt, is rethrown unchanged.
 * {@code maxAttempts} counts calls, not retries.</p>
 */
@Getter
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    static final double MIN_JITTER_FRACTION = 0.1;
    static final double MAX_JITTER_FRACTION = 0.3;

    private final String name;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;

    /**
     * @param jitterSource uniform values in [0, 1); defaults to {@link ThreadLocalRandom}
     */
    @Builder
    private RetryPolicy(
            String name,
            Integer maxAttempts,
            Duration initialDelay,
            Duration maxDelay,
            Predicate<Throwable> retryable,
            Sleeper sleeper,
            DoubleSupplier jitterSource
    ) {
        this.name = name != null ? name : "call";
        this.maxAttempts = maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        this.initialDelay = initialDelay != null ? initialDelay : DEFAULT_INITIAL_DELAY;
        this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
        this.retryable = Objects.requireNonNull(retryable, "retryable");
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD_SLEEP;
        this.jitterSource = jitterSource != null ? jitterSource : () -> ThreadLocalRandom.current().nextDouble();

        if (this.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + this.maxAttempts);
        }
        if (this.initialDelay.isNegative() || this.maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (this.maxDelay.compareTo(this.initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
    }

    /**
     * Runs the call, retrying retryable failures.
     *
     * @param operation Label used in log messages
     * @param call The fallible call
     * @return The call's result
     */
    public <T> T execute(String operation, Supplier<T> call) {
        long delayMillis = initialDelay.toMillis();
        long maxDelayMillis = maxDelay.toMillis();

        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    logger.debug("[{}] Non-retryable failure for {}: {}", name, operation, e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    logger.error("[{}] All {} attempts failed for {}: {}", name, maxAttempts, operation, e.getMessage());
                    throw e;
                }

                long sleepMillis = Math.min(delayMillis + jitterMillis(delayMillis), maxDelayMillis);
                logger.warn("[{}] Attempt {}/{} failed for {}, retrying in {} ms: {}",
                    name, attempt, maxAttempts, operation, sleepMillis, e.getMessage());
                pause(sleepMillis, e);
                delayMillis = Math.min(delayMillis * 2, maxDelayMillis);
            }
        }
    }

    private long jitterMillis(long delayMillis) {
        double fraction = MIN_JITTER_FRACTION
            + (MAX_JITTER_FRACTION - MIN_JITTER_FRACTION) * jitterSource.getAsDouble();
        return Math.round(delayMillis * fraction);
    }

    private void pause(long sleepMillis, RuntimeException pending) {
        try {
            sleeper.sleep(Duration.ofMillis(sleepMillis));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(interrupted);
            throw pending;
        }
    }
}
