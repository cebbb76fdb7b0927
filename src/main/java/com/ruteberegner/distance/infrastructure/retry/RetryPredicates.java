package com.ruteberegner.distance.infrastructure.retry;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Retryability rules for outbound HTTP calls. Each rule walks the cause chain,
 * since adapters wrap WebClient failures in their own exceptions.
 */
public final class RetryPredicates {

    /** Rate limiting and transient upstream unavailability. */
    public static final Set<Integer> TRANSIENT_HTTP_STATUSES = Set.of(429, 502, 503, 504);

    private RetryPredicates() {
        // Utility class
    }

    /**
     * Timeouts, or an HTTP response whose status is in {@code statuses}.
     */
    public static Predicate<Throwable> timeoutOrStatus(Set<Integer> statuses) {
        return failure -> isTimeout(failure) || hasStatus(failure, statuses);
    }

    /**
     * Timeouts, connection-level failures, or an HTTP response whose status is in {@code statuses}.
     */
    public static Predicate<Throwable> transientFailure(Set<Integer> statuses) {
        return failure -> isTimeout(failure) || isConnectionFailure(failure) || hasStatus(failure, statuses);
    }

    static boolean isTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    static boolean isConnectionFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof WebClientRequestException) {
                return true;
            }
        }
        return false;
    }

    static boolean hasStatus(Throwable failure, Set<Integer> statuses) {
        for (Throwable t = failure; t != null; t = nextCause(t)) {
            if (t instanceof WebClientResponseException responseException) {
                return statuses.contains(responseException.getStatusCode().value());
            }
        }
        return false;
    }

    private static Throwable nextCause(Throwable t) {
        Throwable cause = t.getCause();
        return cause == t ? null : cause;
    }
}
