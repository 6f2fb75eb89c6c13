package com.dispatchqueue.app;

import com.dispatchqueue.db.JobStore;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes {@code DONE} jobs older than the retention age from every store.
 * Failed and cancelled jobs are kept for inspection.
 */
public class RetentionSweeper {
    private static final Logger logger = Logger.getLogger(RetentionSweeper.class.getName());

    private final List<JobStore<?>> stores;
    private final Duration retention;
    private final Clock clock;
    private ScheduledExecutorService timer;

    public RetentionSweeper(List<JobStore<?>> stores, Duration retention, Clock clock) {
        this.stores = List.copyOf(stores);
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Run one sweep.
     *
     * @return total rows deleted across all stores
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int total = 0;
        for (JobStore<?> store : stores) {
            try {
                total += store.deleteDoneBefore(cutoff);
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Retention sweep failed for " + store.getName() + " jobs", e);
            }
        }
        logger.info("Retention sweep removed " + total + " done job(s) older than " + retention.toDays() + " days");
        return total;
    }

    public synchronized void start(Duration interval) {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "dispatch-retention");
            thread.setDaemon(true);
            return thread;
        });
        timer.scheduleAtFixedRate(this::sweep, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Retention sweep every " + interval.toHours() + "h, keeping done jobs for " + retention.toDays() + " days");
    }

    public synchronized void stop() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
