package com.dispatchqueue.core;

/**
 * Thrown by strict management operations when a job exists but is not in the state the
 * operation requires (e.g. retrying a job that has not failed).
 */
public class StateConflictException extends RuntimeException {

    private final long jobId;
    private final JobStatus currentStatus;

    public StateConflictException(long jobId, JobStatus currentStatus, String operation) {
        super("Cannot " + operation + " job " + jobId + " with status " + currentStatus.name().toLowerCase(java.util.Locale.ROOT));
        this.jobId = jobId;
        this.currentStatus = currentStatus;
    }

    public long getJobId() {
        return jobId;
    }

    /**
     * Get the status the job had when the operation was rejected.
     *
     * @return the current status
     */
    public JobStatus getCurrentStatus() {
        return currentStatus;
    }
}
