package com.dispatchqueue.engine;

import java.time.Duration;

/**
 * Deterministic exponential backoff: {@code base * 2^retryIndex}, no jitter.
 *
 * <p>With the default base of 60 seconds the first three retries wait 60, 120 and 240
 * seconds. The exponent is capped at {@value #MAX_EXPONENT} so very large retry budgets
 * cannot overflow.</p>
 */
public class ExponentialBackoff implements BackoffPolicy {
    public static final long DEFAULT_BASE_DELAY_SECONDS = 60;
    static final int MAX_EXPONENT = 30;

    private final Duration baseDelay;

    public ExponentialBackoff() {
        this(Duration.ofSeconds(DEFAULT_BASE_DELAY_SECONDS));
    }

    public ExponentialBackoff(long baseDelaySeconds) {
        this(Duration.ofSeconds(baseDelaySeconds));
    }

    public ExponentialBackoff(Duration baseDelay) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay must be >= 0, got " + baseDelay);
        }
        this.baseDelay = baseDelay;
    }

    @Override
    public Duration delay(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("Retry index must be >= 0, got " + retryIndex);
        }
        return baseDelay.multipliedBy(1L << Math.min(retryIndex, MAX_EXPONENT));
    }
}
