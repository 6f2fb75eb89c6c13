package com.dispatchqueue.engine;

import com.dispatchqueue.core.JobExecutionException;
import com.dispatchqueue.core.JobInput;
import com.dispatchqueue.core.JobPayload;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.QueueStats;
import com.dispatchqueue.core.StateConflictException;
import com.dispatchqueue.db.JobStore;
import com.dispatchqueue.time.TimeResolver;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent job queue engine for one job flavor.
 *
 * <p>Each job moves through this state machine, driven by {@link #process(long)}:</p>
 * <pre>
 * pending    --(claimed)--------------------------> processing
 * processing --(executor succeeds)----------------> done
 * processing --(fails, retryCount &lt; maxRetries)--> pending (delayed re-run)
 * processing --(fails, retryCount &gt;= maxRetries)-> failed
 * pending/processing --(cancel)-------------------> cancelled
 * failed     --(retry)----------------------------> pending, re-run immediately
 * </pre>
 *
 * <p><b>Threading:</b> all processing for one queue is serialized on a single worker
 * thread, so a queue never runs two of its jobs at once. Executor calls run on a single
 * helper thread so the execution timeout can be enforced. A timed-out call is interrupted,
 * and the worker does not move on until that call has returned. Delayed retries are timers
 * on a separate scheduled executor; they are cancelled on shutdown.</p>
 *
 * <p><b>Cancellation</b> is cooperative. Cancelling a job does not interrupt its in-flight
 * executor call; instead every write after the claim is conditional on the row still being
 * {@code PROCESSING}, so a cancel that lands mid-flight wins. Only an execution timeout
 * interrupts the call.</p>
 *
 * @param <P> the payload flavor
 * @see Scheduler
 */
public class JobQueue<P extends JobPayload> {
    private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);
    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final long ABANDONED_CALL_GRACE_MS = 1000;

    private final String name;
    private final JobStore<P> store;
    private final JobExecutor<P> executor;
    private final BackoffPolicy backoff;
    private final CompletionNotifier notifier;
    private final Clock clock;
    private final TimeResolver timeResolver;
    private final Duration executionTimeout;
    private final Duration shutdownTimeout;

    private final ThreadPoolExecutor worker;
    private final ExecutorService executionPool;
    private final ScheduledExecutorService retryTimer;
    private final Set<ScheduledFuture<?>> retryTimers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public JobQueue(JobStore<P> store, JobExecutor<P> executor, BackoffPolicy backoff,
                    CompletionNotifier notifier, Clock clock) {
        this(store, executor, backoff, notifier, clock, DEFAULT_EXECUTION_TIMEOUT, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Create a queue over {@code store}.
     *
     * @param store persistence for this flavor
     * @param executor performs each attempt
     * @param backoff delay policy between attempts
     * @param notifier completion messages, for payloads that request them
     * @param clock time source; must be the same clock the store resolves schedules with
     * @param executionTimeout bound on one executor call; zero disables the bound
     * @param shutdownTimeout how long {@link #shutdown()} waits for the in-flight job
     */
    public JobQueue(JobStore<P> store, JobExecutor<P> executor, BackoffPolicy backoff,
                    CompletionNotifier notifier, Clock clock,
                    Duration executionTimeout, Duration shutdownTimeout) {
        this.name = store.getName();
        this.store = store;
        this.executor = executor;
        this.backoff = backoff;
        this.notifier = notifier != null ? notifier : CompletionNotifier.NONE;
        this.clock = clock;
        this.timeResolver = new TimeResolver(clock);
        this.executionTimeout = executionTimeout;
        this.shutdownTimeout = shutdownTimeout;

        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), threadFactory(name + "-worker"));
        this.executionPool = Executors.newSingleThreadExecutor(threadFactory(name + "-exec"));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-retry"));
    }

    /**
     * Persist a new job and, when it is already due, start processing it.
     * Future jobs are left to the {@link Scheduler}.
     *
     * @param input producer request
     * @return the new job id
     * @throws SQLException if the insert fails
     */
    public long enqueue(JobInput<P> input) throws SQLException {
        long id = store.create(input);
        JobRecord<P> job = store.get(id);
        if (job != null && job.isDue(clock.instant())) {
            process(id);
        } else {
            logger.info("Queued " + name + " job " + id + (job != null
                    ? " for " + job.getScheduledFor() + " (" + timeResolver.formatRelative(job.getScheduledFor()) + ")"
                    : ""));
        }
        return id;
    }

    /**
     * Submit one attempt of job {@code id} to the worker.
     *
     * <p>The attempt is a no-op when the queue is shutting down, the job is absent, not
     * {@code PENDING}, not yet due, or claimed by someone else first. Store failures are
     * logged and surface through the returned future.</p>
     *
     * @param id job id
     * @return completes when the attempt has been handled
     */
    public Future<Void> process(long id) {
        if (shuttingDown.get()) {
            logger.fine("Queue " + name + " shutting down, job " + id + " stays pending");
            return CompletableFuture.completedFuture(null);
        }
        try {
            return worker.submit(() -> {
                try {
                    runJob(id);
                } catch (SQLException e) {
                    if (shuttingDown.get() && Thread.currentThread().isInterrupted()) {
                        logger.warning("Forced shutdown interrupted " + name + " job " + id
                                + "; if it was claimed it stays PROCESSING until recovery on the next start");
                    }
                    logger.log(Level.SEVERE, "Store failure while processing " + name + " job " + id, e);
                    throw e;
                }
                return null;
            });
        } catch (RejectedExecutionException e) {
            logger.fine("Worker for " + name + " no longer accepts tasks, job " + id + " stays pending");
            return CompletableFuture.completedFuture(null);
        }
    }

    private void runJob(long id) throws SQLException {
        if (shuttingDown.get()) {
            return;
        }

        JobRecord<P> job = store.get(id);
        if (job == null) {
            logger.warning(name + " job " + id + " not found");
            return;
        }
        if (job.getStatus().isTerminal()) {
            logger.fine("Skipping " + name + " job " + id + ", already " + job.getStatus());
            return;
        }
        if (job.getStatus() != JobStatus.PENDING) {
            logger.fine("Skipping " + name + " job " + id + ", already being processed");
            return;
        }
        if (!job.isDue(clock.instant())) {
            logger.fine("Skipping " + name + " job " + id + ", not due until " + job.getScheduledFor());
            return;
        }

        // Atomic claim: PENDING -> PROCESSING, keeping the previous error for the executor
        if (!store.transition(id, JobStatus.PENDING, JobStatus.PROCESSING, job.getLastError())) {
            logger.fine(name + " job " + id + " was claimed or changed concurrently");
            return;
        }
        job.setStatus(JobStatus.PROCESSING);
        logger.info("Processing " + name + " job " + id + " (" + job.getPayload().describe()
                + ", attempt " + (job.getRetryCount() + 1) + ")");

        String receipt;
        try {
            receipt = execute(job);
        } catch (JobExecutionException e) {
            if (shuttingDown.get() && Thread.currentThread().isInterrupted()) {
                logger.warning(name + " job " + id + " was interrupted by a forced shutdown; it stays PROCESSING"
                        + " until recovery on the next start");
                return;
            }
            handleFailure(job, e);
            return;
        }
        handleSuccess(job, receipt);
    }

    private String execute(JobRecord<P> job) throws JobExecutionException {
        long startTime = System.currentTimeMillis();
        // 0 = not started, 1 = running, 2 = abandoned before it started
        AtomicInteger callState = new AtomicInteger();
        CountDownLatch returned = new CountDownLatch(1);
        Future<String> call = executionPool.submit(() -> {
            if (!callState.compareAndSet(0, 1)) {
                return null;
            }
            try {
                return executor.execute(job);
            } finally {
                returned.countDown();
            }
        });
        try {
            String receipt = executionTimeout.isZero()
                    ? call.get()
                    : call.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.fine(name + " job " + job.getId() + " executed in " + (System.currentTimeMillis() - startTime) + "ms");
            return receipt;
        } catch (TimeoutException e) {
            call.cancel(true);
            if (!callState.compareAndSet(0, 2)) {
                awaitAbandonedCall(job, returned);
            }
            throw JobExecutionException.timedOut(job.getId(), executionTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JobExecutionException) {
                throw (JobExecutionException) cause;
            }
            throw new JobExecutionException(describeFailure(cause), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new JobExecutionException("Interrupted while executing job " + job.getId(), e);
        }
    }

    private void awaitAbandonedCall(JobRecord<P> job, CountDownLatch returned) {
        try {
            if (!returned.await(ABANDONED_CALL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                logger.warning(name + " job " + job.getId() + " ignored the timeout interrupt, waiting for its call to return");
                returned.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void handleSuccess(JobRecord<P> job, String receipt) throws SQLException {
        long id = job.getId();
        if (!store.markDone(id, receipt)) {
            logger.info(name + " job " + id + " changed state while executing, result discarded");
            return;
        }
        logger.info("Completed " + name + " job " + id + (receipt != null ? " (receipt " + receipt + ")" : ""));
        if (job.getPayload().isNotifyOnComplete()) {
            notifyCompletion("Completed " + job.getPayload().describe(), CompletionNotifier.Outcome.SUCCESS);
        }
    }

    private void handleFailure(JobRecord<P> job, JobExecutionException failure) throws SQLException {
        long id = job.getId();
        String error = failure.getMessage();
        logger.log(Level.WARNING, name + " job " + id + " failed: " + error, failure.getCause());

        JobRecord<P> current = store.get(id);
        if (current == null || current.getStatus() != JobStatus.PROCESSING) {
            logger.info(name + " job " + id + " is no longer processing, skipping retry bookkeeping");
            return;
        }

        store.incrementRetry(id);
        JobRecord<P> refreshed = store.get(id);
        if (refreshed == null) {
            logger.info(name + " job " + id + " was deleted while failing");
            return;
        }
        int retryCount = refreshed.getRetryCount();
        int maxRetries = refreshed.getMaxRetries();

        if (refreshed.isRetryExhausted()) {
            if (store.transition(id, JobStatus.PROCESSING, JobStatus.FAILED, error)) {
                logger.warning(name + " job " + id + " failed permanently after " + retryCount + " attempt(s): " + error);
                if (job.getPayload().isNotifyOnComplete()) {
                    notifyCompletion("Failed " + job.getPayload().describe() + " after " + retryCount
                            + " attempt(s): " + error, CompletionNotifier.Outcome.FAILURE);
                }
            }
            return;
        }

        Duration delay = backoff.delay(retryCount - 1);
        Instant nextAttempt = clock.instant().plus(delay);
        if (store.scheduleRetry(id, nextAttempt, error)) {
            logger.info(name + " job " + id + " will retry in " + delay.toSeconds() + "s (attempt "
                    + (retryCount + 1) + "/" + maxRetries + ")");
            scheduleRetryTimer(id, delay);
        }
    }

    private void scheduleRetryTimer(long id, Duration delay) {
        if (shuttingDown.get()) {
            return;
        }
        retryTimers.removeIf(Future::isDone);
        try {
            retryTimers.add(retryTimer.schedule(() -> process(id), delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.fine("Retry timer stopped, " + name + " job " + id + " left for the scheduler");
        }
    }

    private void notifyCompletion(String summary, CompletionNotifier.Outcome outcome) {
        try {
            notifier.emit(summary, outcome);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Completion notification failed for " + name + " queue", e);
        }
    }

    /**
     * Cancel a pending or processing job.
     *
     * @return false when the job is absent or already terminal
     */
    public boolean cancel(long id) throws SQLException {
        return store.cancel(id);
    }

    /**
     * Reset a failed job and run it again right away.
     *
     * @return false unless the job was {@code FAILED}
     */
    public boolean retry(long id) throws SQLException {
        if (!store.retryNow(id)) {
            return false;
        }
        process(id);
        return true;
    }

    /**
     * Like {@link #cancel(long)}, but a job that exists in a terminal state is reported as a
     * conflict instead of {@code false}.
     *
     * @return false only when the job does not exist
     * @throws StateConflictException if the job cannot be cancelled from its current status
     */
    public boolean cancelStrict(long id) throws SQLException {
        JobRecord<P> job = store.get(id);
        if (job == null) {
            return false;
        }
        if (!job.getStatus().isCancellable()) {
            throw new StateConflictException(id, job.getStatus(), "cancel");
        }
        if (!store.cancel(id)) {
            throw new StateConflictException(id, currentStatus(id, job.getStatus()), "cancel");
        }
        return true;
    }

    /**
     * Like {@link #retry(long)}, but a job that is not {@code FAILED} is reported as a conflict.
     *
     * @return false only when the job does not exist
     * @throws StateConflictException if the job has not failed
     */
    public boolean retryStrict(long id) throws SQLException {
        JobRecord<P> job = store.get(id);
        if (job == null) {
            return false;
        }
        if (job.getStatus() != JobStatus.FAILED) {
            throw new StateConflictException(id, job.getStatus(), "retry");
        }
        if (!store.retryNow(id)) {
            throw new StateConflictException(id, currentStatus(id, job.getStatus()), "retry");
        }
        process(id);
        return true;
    }

    private JobStatus currentStatus(long id, JobStatus fallback) throws SQLException {
        JobRecord<P> latest = store.get(id);
        return latest != null ? latest.getStatus() : fallback;
    }

    public JobRecord<P> get(long id) throws SQLException {
        return store.get(id);
    }

    public QueueStats stats() throws SQLException {
        return store.stats(clock.instant());
    }

    public List<JobRecord<P>> listDue() throws SQLException {
        return listDue(clock.instant());
    }

    public List<JobRecord<P>> listDue(Instant now) throws SQLException {
        return store.queryDue(now);
    }

    // Newest failures first
    public List<JobRecord<P>> listFailed(int limit) throws SQLException {
        return store.queryByStatus(JobStatus.FAILED, limit);
    }

    public List<JobRecord<P>> listFailed() throws SQLException {
        return listFailed(DEFAULT_LIST_LIMIT);
    }

    public List<JobRecord<P>> listScheduled(int limit) throws SQLException {
        return store.queryScheduled(clock.instant(), limit);
    }

    /**
     * Most recent jobs, newest first.
     *
     * @param status only this status, or null for all
     * @param limit maximum rows
     */
    public List<JobRecord<P>> history(JobStatus status, int limit) throws SQLException {
        return store.queryHistory(status, limit);
    }

    /**
     * Reset jobs left {@code PROCESSING} by a previous run to {@code PENDING}.
     * Run once at startup, before the scheduler is armed.
     *
     * @return number of jobs recovered
     */
    public int recover() throws SQLException {
        List<JobRecord<P>> stuck = store.queryByStatus(JobStatus.PROCESSING, Integer.MAX_VALUE);
        for (JobRecord<P> job : stuck) {
            store.setStatus(job.getId(), JobStatus.PENDING, job.getLastError());
        }
        if (!stuck.isEmpty()) {
            logger.info("Recovered " + stuck.size() + " stuck " + name + " job(s)");
        }
        return stuck.size();
    }

    /**
     * Stop processing. Retry timers are cancelled, tasks already queued on the worker drain
     * as no-ops and the in-flight job (if any) gets up to the shutdown timeout to finish.
     * Pending jobs stay {@code PENDING} in the store.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down " + name + " queue...");

        for (ScheduledFuture<?> timer : retryTimers) {
            timer.cancel(false);
        }
        retryTimers.clear();
        retryTimer.shutdownNow();

        worker.shutdown();
        try {
            if (!worker.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("In-flight " + name + " job did not finish within " + shutdownTimeout.toSeconds()
                        + "s, forcing shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executionPool.shutdownNow();

        logger.info(name + " queue shutdown complete");
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    // Tasks waiting for or running on the worker
    public int getQueueSize() {
        return worker.getQueue().size() + worker.getActiveCount();
    }

    public String getName() {
        return name;
    }

    private static String describeFailure(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dispatch-" + prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
