package com.dispatchqueue.engine;

import com.dispatchqueue.core.JobPayload;
import com.dispatchqueue.core.JobRecord;

/**
 * Performs the side effect of a job: posts the chat message, fires the automation.
 *
 * <p>Any exception counts as a failed attempt and feeds the retry path. Implementations may
 * be called again for the same job after a failure, so they see the current
 * {@code retryCount}.</p>
 *
 * @param <P> the payload flavor
 */
@FunctionalInterface
public interface JobExecutor<P extends JobPayload> {

    /**
     * Execute one attempt.
     *
     * @param job the claimed job, status {@code PROCESSING}
     * @return an optional delivery receipt stored on the job, or null
     * @throws Exception if the attempt failed
     */
    String execute(JobRecord<P> job) throws Exception;
}
