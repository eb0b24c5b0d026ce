package com.blocksub.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between reconnect attempts. The base delay doubles per attempt up to the cap; the result is
 * scaled by a random factor in [1 - jitterFactor, 1 + jitterFactor].
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitterFactor);
    }

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Require 0 <= baseDelay <= maxDelay, got " + baseDelay + " / " + maxDelay);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], got " + jitterFactor);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
    }

    /**
     * Delay before the given zero-based retry.
     */
    public Duration delay(int attempt) {
        long capMs = maxDelay.toMillis();
        long delayMs = baseDelay.toMillis();
        for (int i = 0; i < attempt && delayMs < capMs; i++) {
            delayMs = Math.min(delayMs * 2, capMs);
        }
        return Duration.ofMillis(applyJitter(delayMs));
    }

    private long applyJitter(long delayMs) {
        if (jitterFactor == 0 || delayMs == 0) {
            return delayMs;
        }
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Math.max(0, Math.round(delayMs * factor));
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
