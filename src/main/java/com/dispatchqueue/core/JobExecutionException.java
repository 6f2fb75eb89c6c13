package com.dispatchqueue.core;

/**
 * Failure of a single executor attempt.
 *
 * <p>The queue engine catches these and feeds them into the retry/backoff path, so they never
 * reach the producer that enqueued the job.</p>
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static JobExecutionException timedOut(long jobId, long timeoutMillis) {
        return new JobExecutionException("Job " + jobId + " timed out after " + timeoutMillis + "ms");
    }
}
