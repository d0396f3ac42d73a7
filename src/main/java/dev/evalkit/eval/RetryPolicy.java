package dev.evalkit.eval;

import java.time.Duration;
import java.util.Optional;

/**
 * Retry budget and exponential backoff for retryable model errors.
 *
 * @param maxRetries retries after the first attempt
 * @param initialBackoff delay before the first retry, doubled for each further retry
 * @param maxBackoff cap on the computed exponential delay
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff) {
    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before retry number {@code retry} (0-based). A provider retry-after hint is honored
     * when it is longer than the computed delay.
     */
    public Duration backoff(int retry, Optional<Duration> retryAfter) {
        long millis = initialBackoff.toMillis() * (1L << Math.min(retry, 20));
        var computed = Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
        return retryAfter.filter(hint -> hint.compareTo(computed) > 0).orElse(computed);
    }
}
