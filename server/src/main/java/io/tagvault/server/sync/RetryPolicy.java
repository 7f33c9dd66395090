// file: server/src/main/java/io/tagvault/server/sync/RetryPolicy.java
package io.tagvault.server.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for failed sync cycles.
 *
 * @param maxRetries    retries after the first attempt
 * @param initialDelay  delay before the first retry
 * @param maxDelay      upper bound for any delay
 * @param backoffFactor multiplier applied per retry
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffFactor) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (backoffFactor < 1.0) throw new IllegalArgumentException("backoffFactor must be >= 1");
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0)
            throw new IllegalArgumentException("need 0 <= initialDelay <= maxDelay");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }

    /** @param retry zero-based index of the retry about to happen */
    public boolean allowsRetry(int retry) {
        return retry < maxRetries;
    }

    /** Delay before retry number {@code retry} (zero-based). */
    public long delayMillis(int retry) {
        double raw = initialDelay.toMillis() * Math.pow(backoffFactor, retry);
        return (long) Math.min(raw, (double) maxDelay.toMillis());
    }
}
