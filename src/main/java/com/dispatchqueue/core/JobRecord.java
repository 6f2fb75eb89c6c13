package com.dispatchqueue.core;

import java.time.Instant;

/**
 * Snapshot of one persisted job row.
 *
 * <p>Both job flavors share this shape; only the payload type differs. A record is a copy
 * of the row at read time, so callers that need the current state must read it again.</p>
 *
 * @param <P> the payload flavor
 */
public class JobRecord<P extends JobPayload> {
    private long id;
    private Instant createdAt;
    private Instant scheduledFor;
    private Instant executedAt;
    private JobStatus status;
    private int retryCount;
    private int maxRetries;
    private String lastError;
    private String receipt;
    private P payload;

    // Getters and Setters
    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getScheduledFor() { return scheduledFor; }
    public void setScheduledFor(Instant scheduledFor) { this.scheduledFor = scheduledFor; }

    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public String getReceipt() { return receipt; }
    public void setReceipt(String receipt) { this.receipt = receipt; }

    public P getPayload() { return payload; }
    public void setPayload(P payload) { this.payload = payload; }

    /**
     * A job is due once its scheduled time is at or before {@code now}.
     *
     * @param now the reference instant
     * @return true if the job may run at {@code now}
     */
    public boolean isDue(Instant now) {
        return scheduledFor == null || !scheduledFor.isAfter(now);
    }

    /**
     * Whether the retry budget is spent.
     *
     * @return true when {@code retryCount >= maxRetries}
     */
    public boolean isRetryExhausted() {
        return retryCount >= maxRetries;
    }

    @Override
    public String toString() {
        return "JobRecord{" +
                "id=" + id +
                ", status=" + status +
                ", scheduledFor=" + scheduledFor +
                ", retryCount=" + retryCount + "/" + maxRetries +
                ", payload=" + payload +
                '}';
    }
}
