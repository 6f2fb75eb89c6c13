package com.dispatchqueue.core;

/**
 * Flavor-specific data carried by a job.
 *
 * <p>The queue engine treats payloads as opaque. It only asks whether a completion message
 * was requested and how to describe the job in log lines and completion summaries.</p>
 *
 * @see DeliveryPayload
 * @see TriggerPayload
 */
public interface JobPayload {

    /**
     * Short human-readable description used in logs and completion messages.
     *
     * @return description of the work, never null
     */
    String describe();

    /**
     * Whether a success/failure message should be emitted once the job settles.
     *
     * @return true if the producer asked to be told about the outcome
     */
    default boolean isNotifyOnComplete() {
        return false;
    }
}
