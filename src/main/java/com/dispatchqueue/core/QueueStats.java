package com.dispatchqueue.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts for one job queue.
 *
 * <ul>
 *   <li>{@code pending}: pending jobs that are already due</li>
 *   <li>{@code processing}: jobs currently claimed by the worker</li>
 *   <li>{@code scheduledFuture}: pending jobs whose scheduled time is still ahead</li>
 *   <li>{@code failed}: jobs parked after exhausting retries</li>
 *   <li>{@code doneRecent}: jobs completed within the trailing 24 hours</li>
 * </ul>
 */
public class QueueStats {
    private final long pending;
    private final long processing;
    private final long scheduledFuture;
    private final long failed;
    private final long doneRecent;

    public QueueStats(long pending, long processing, long scheduledFuture, long failed, long doneRecent) {
        this.pending = pending;
        this.processing = processing;
        this.scheduledFuture = scheduledFuture;
        this.failed = failed;
        this.doneRecent = doneRecent;
    }

    public long getPending() { return pending; }
    public long getProcessing() { return processing; }
    public long getScheduledFuture() { return scheduledFuture; }
    public long getFailed() { return failed; }
    public long getDoneRecent() { return doneRecent; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("pending", pending);
        map.put("processing", processing);
        map.put("scheduled_future", scheduledFuture);
        map.put("failed", failed);
        map.put("done_recent", doneRecent);
        return map;
    }

    @Override
    public String toString() {
        return "QueueStats" + toMap();
    }
}
