package com.dispatchqueue.core;

/**
 * Enum representing the states a job moves through from creation to completion.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → PROCESSING: job claimed by its queue's worker</li>
 *   <li>PENDING → CANCELLED: job cancelled before it started</li>
 *   <li>PROCESSING → DONE: executor succeeded</li>
 *   <li>PROCESSING → PENDING: executor failed, retry scheduled (or crash recovery)</li>
 *   <li>PROCESSING → FAILED: executor failed and the retry budget is spent</li>
 *   <li>PROCESSING → CANCELLED: cancelled while the executor call was in flight</li>
 *   <li>FAILED → PENDING: explicit manual retry</li>
 * </ul>
 *
 * <p>The enum name is what gets persisted in the {@code status} column.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending"),
    PROCESSING("Processing"),
    DONE("Done"),
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Done", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status is terminal for automatic processing.
     *
     * <p>{@code FAILED} counts as terminal even though a manual retry can move it back to
     * {@code PENDING}: the engine never picks it up on its own.</p>
     *
     * @return true for DONE, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    /**
     * Check whether an explicit cancel is allowed from this status.
     *
     * @return true for PENDING and PROCESSING
     */
    public boolean isCancellable() {
        return this == PENDING || this == PROCESSING;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * @param newStatus the target status to transition to
     * @return true if the transition is allowed by the job state machine
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        return switch (this) {
            case PENDING -> newStatus == PROCESSING || newStatus == CANCELLED;
            case PROCESSING -> newStatus == DONE || newStatus == PENDING
                    || newStatus == FAILED || newStatus == CANCELLED;
            case FAILED -> newStatus == PENDING;
            case DONE, CANCELLED -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
