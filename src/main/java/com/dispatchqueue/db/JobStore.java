package com.dispatchqueue.db;

import com.dispatchqueue.core.JobInput;
import com.dispatchqueue.core.JobPayload;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.QueueStats;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Durable storage for one flavor of job.
 *
 * <p>Every operation touches a single row, either with one SQL statement or one short
 * transaction, so it is atomic with respect to other callers. Conditional writes
 * ({@link #transition}, {@link #markDone}, {@link #cancel}, {@link #retryNow}) only apply
 * when the row still has the expected status and report whether they did.</p>
 *
 * @param <P> the payload flavor
 */
public interface JobStore<P extends JobPayload> {

    /**
     * Validate and persist a new job in {@code PENDING}.
     *
     * @param input producer request
     * @return the new job id
     * @throws com.dispatchqueue.core.ValidationException if required payload data is missing
     * @throws com.dispatchqueue.core.TimeParseException if the schedule expression is not recognised
     * @throws SQLException if the insert fails
     */
    long create(JobInput<P> input) throws SQLException;

    /**
     * @return the job, or null when no row has this id
     */
    JobRecord<P> get(long id) throws SQLException;

    /**
     * Unconditional status write. {@code DONE} stamps {@code executedAt}, every other status
     * clears it; {@code error} replaces {@code lastError}.
     */
    void setStatus(long id, JobStatus status, String error) throws SQLException;

    /**
     * Status write that only applies while the row still has {@code expected} status.
     *
     * @return true if the row was updated
     * @throws IllegalArgumentException if {@code expected -> status} is not a state machine edge
     */
    boolean transition(long id, JobStatus expected, JobStatus status, String error) throws SQLException;

    /**
     * {@code PROCESSING -> DONE}, recording the delivery receipt.
     *
     * @return false if the job was no longer processing
     */
    boolean markDone(long id, String receipt) throws SQLException;

    /**
     * Atomically add one to {@code retryCount}.
     *
     * @return the new retry count
     * @throws SQLException if the job does not exist or the update fails
     */
    int incrementRetry(long id) throws SQLException;

    /**
     * {@code PROCESSING -> PENDING} for a failed attempt, pushing {@code scheduledFor} out to
     * {@code nextAttempt} and recording the error.
     *
     * @return false if the job was no longer processing
     */
    boolean scheduleRetry(long id, Instant nextAttempt, String error) throws SQLException;

    // Pending jobs with scheduledFor <= cutoff, earliest first
    List<JobRecord<P>> queryDue(Instant cutoff) throws SQLException;

    List<JobRecord<P>> queryByStatus(JobStatus status, int limit) throws SQLException;

    // Pending jobs with scheduledFor > after, earliest first
    List<JobRecord<P>> queryScheduled(Instant after, int limit) throws SQLException;

    List<JobRecord<P>> queryHistory(JobStatus status, int limit) throws SQLException;

    /**
     * Move a pending or processing job to {@code CANCELLED}.
     *
     * @return false when the job is absent or already terminal
     */
    boolean cancel(long id) throws SQLException;

    /**
     * Reset a failed job to {@code PENDING} with a fresh retry budget.
     *
     * @return false unless the job was {@code FAILED}
     */
    boolean retryNow(long id) throws SQLException;

    QueueStats stats(Instant now) throws SQLException;

    // Retention: delete DONE rows executed before cutoff
    int deleteDoneBefore(Instant cutoff) throws SQLException;

    /**
     * Short name used in logs and the stats endpoint.
     */
    String getName();
}
