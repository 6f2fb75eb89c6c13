package com.dispatchqueue.core;

import java.time.Instant;

/**
 * Producer request for a new job.
 *
 * <p>The schedule may be given either as an absolute instant or as a time expression
 * ("5m", "2 hours", "now", an ISO date). When both are absent the job is immediate.
 * {@code maxRetries} falls back to the store default when null.</p>
 *
 * @param <P> the payload flavor
 */
public class JobInput<P extends JobPayload> {
    private final P payload;
    private Instant scheduledAt;
    private String scheduleExpression;
    private Integer maxRetries;

    public JobInput(P payload) {
        this.payload = payload;
    }

    public static <P extends JobPayload> JobInput<P> of(P payload) {
        return new JobInput<>(payload);
    }

    public P getPayload() {
        return payload;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public String getScheduleExpression() {
        return scheduleExpression;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public JobInput<P> scheduledAt(Instant scheduledAt) {
        this.scheduledAt = scheduledAt;
        this.scheduleExpression = null;
        return this;
    }

    public JobInput<P> scheduledFor(String scheduleExpression) {
        this.scheduleExpression = scheduleExpression;
        this.scheduledAt = null;
        return this;
    }

    public JobInput<P> maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public boolean hasScheduleExpression() {
        return scheduleExpression != null && !scheduleExpression.isBlank();
    }
}
