package com.dispatchqueue.engine;

import java.time.Duration;

/**
 * Delay before the next attempt of a failed job.
 */
public interface BackoffPolicy {

    /**
     * @param retryIndex zero-based index of the retry about to be scheduled
     * @return how long to wait before running it
     */
    Duration delay(int retryIndex);
}
