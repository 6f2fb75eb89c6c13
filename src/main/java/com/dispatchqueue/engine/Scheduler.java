package com.dispatchqueue.engine;

import com.dispatchqueue.core.JobRecord;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls every registered {@link JobQueue} for due jobs and hands them to the queue.
 *
 * <p>Immediate jobs never wait for the scheduler; it exists for jobs scheduled in the future,
 * jobs waiting out a retry backoff and jobs recovered at startup.</p>
 *
 * <p><b>Tick:</b> for each queue, the due jobs are processed in ascending
 * {@code scheduledFor} order, one at a time, waiting for each attempt to finish. A store
 * failure in one queue is logged and the remaining queues still run.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * Scheduler scheduler = new Scheduler(clock, List.of(notificationQueue, automationQueue));
 * scheduler.start(30);
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    public static final long DEFAULT_INTERVAL_SECONDS = 30;

    private final Clock clock;
    private final List<JobQueue<?>> queues;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledExecutorService timer;
    private volatile long intervalSeconds = DEFAULT_INTERVAL_SECONDS;

    public Scheduler(Clock clock, List<JobQueue<?>> queues) {
        this.clock = clock;
        this.queues = List.copyOf(queues);
    }

    /**
     * Run one polling pass over all queues.
     *
     * @return number of due jobs handed to their queues
     */
    public int tick() {
        Instant now = clock.instant();
        int total = 0;

        for (JobQueue<?> queue : queues) {
            if (queue.isShuttingDown()) {
                continue;
            }
            try {
                int processed = processDue(queue, now);
                if (processed > 0) {
                    logger.info("Processed " + processed + " due " + queue.getName() + " job(s)");
                }
                total += processed;
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to query due " + queue.getName() + " jobs", e);
            } catch (InterruptedException e) {
                logger.info("Scheduler tick interrupted");
                Thread.currentThread().interrupt();
                break;
            }
        }

        logger.fine("Scheduler tick complete, " + total + " due job(s)");
        return total;
    }

    private int processDue(JobQueue<?> queue, Instant now) throws SQLException, InterruptedException {
        List<? extends JobRecord<?>> due = queue.listDue(now);
        int processed = 0;
        for (JobRecord<?> job : due) {
            try {
                queue.process(job.getId()).get();
            } catch (ExecutionException e) {
                // Already logged by the queue; keep going with the next job
                logger.log(Level.FINE, "Attempt for " + queue.getName() + " job " + job.getId() + " failed", e.getCause());
            }
            processed++;
        }
        return processed;
    }

    /**
     * Arm the scheduler: tick now, then every {@code intervalSeconds}.
     * A second call while running is ignored.
     *
     * @param intervalSeconds polling interval, must be positive
     */
    public void start(long intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Scheduler interval must be positive, got " + intervalSeconds);
        }
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }

        this.intervalSeconds = intervalSeconds;
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "dispatch-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::safeTick, 0, intervalSeconds, TimeUnit.SECONDS);
        this.timer = executor;

        logger.info("Scheduler started, checking " + queues.size() + " queue(s) every " + intervalSeconds + "s");
    }

    public void start() {
        start(DEFAULT_INTERVAL_SECONDS);
    }

    // scheduleAtFixedRate stops rescheduling after an uncaught exception
    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error in scheduler tick", e);
        }
    }

    /**
     * Disarm the scheduler and wait briefly for a running tick to finish.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService executor = timer;
        timer = null;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warning("Scheduler tick still running, forcing stop");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Scheduler stopped");
    }

    public boolean isActive() {
        return running.get();
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }
}
