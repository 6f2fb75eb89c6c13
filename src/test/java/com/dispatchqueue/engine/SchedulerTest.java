package com.dispatchqueue.engine;

import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.JobInput;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.TriggerPayload;
import com.dispatchqueue.db.AutomationTriggerStore;
import com.dispatchqueue.db.Database;
import com.dispatchqueue.db.NotificationStore;
import com.dispatchqueue.time.MutableClock;
import com.dispatchqueue.time.TimeResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    private Database database;
    private MutableClock clock;
    private NotificationStore notificationStore;
    private AutomationTriggerStore triggerStore;
    private JobQueue<DeliveryPayload> notificationQueue;
    private JobQueue<TriggerPayload> automationQueue;
    private Scheduler scheduler;

    private final List<String> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void setUp() throws SQLException {
        database = Database.inMemory("scheduler-" + UUID.randomUUID());
        database.initialize();
        clock = new MutableClock(T0);
        TimeResolver resolver = new TimeResolver(clock);

        notificationStore = new NotificationStore(database, resolver, 3);
        triggerStore = new AutomationTriggerStore(database, resolver, 3);
        notificationQueue = new JobQueue<>(notificationStore, job -> {
            executed.add(job.getPayload().getMessage());
            return null;
        }, new ExponentialBackoff(Duration.ZERO), CompletionNotifier.NONE, clock);
        automationQueue = new JobQueue<>(triggerStore, job -> {
            executed.add(job.getPayload().getAutomationId());
            return null;
        }, new ExponentialBackoff(Duration.ZERO), CompletionNotifier.NONE, clock);

        scheduler = new Scheduler(clock, List.of(notificationQueue, automationQueue));
    }

    @AfterEach
    public void tearDown() {
        scheduler.stop();
        notificationQueue.shutdown();
        automationQueue.shutdown();
        database.close();
    }

    private long notification(String message, String when) throws SQLException {
        return notificationStore.create(JobInput.of(new DeliveryPayload("test", message)).scheduledFor(when));
    }

    @Test
    public void testTickProcessesDueJobsInScheduleOrder() throws Exception {
        notification("third", "3m");
        notification("first", "1m");
        notification("second", "2m");
        notification("tomorrow", "1d");
        triggerStore.create(JobInput.of(new TriggerPayload("automation.porch", "user-1")).scheduledFor("2m"));

        assertEquals(0, scheduler.tick());
        assertTrue(executed.isEmpty());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(4, scheduler.tick());
        assertEquals(List.of("first", "second", "third", "automation.porch"), executed);

        assertEquals(0, scheduler.tick(), "completed jobs are not picked up again");
        assertEquals(1, notificationQueue.stats().getScheduledFuture());
    }

    @Test
    public void testTickPicksUpRecoveredJobs() throws Exception {
        long stuck = notification("stuck", "now");
        notificationStore.transition(stuck, JobStatus.PENDING, JobStatus.PROCESSING, null);

        assertEquals(0, scheduler.tick());
        assertEquals(1, notificationQueue.recover());
        assertEquals(1, scheduler.tick());
        assertEquals(JobStatus.DONE, notificationStore.get(stuck).getStatus());
    }

    @Test
    public void testStoreFailureInOneQueueDoesNotStopOthers() throws Exception {
        Database broken = Database.inMemory("scheduler-broken-" + UUID.randomUUID());
        broken.initialize();
        NotificationStore brokenStore = new NotificationStore(broken, new TimeResolver(clock), 3);
        JobQueue<DeliveryPayload> brokenQueue = new JobQueue<>(brokenStore, job -> null,
                new ExponentialBackoff(Duration.ZERO), CompletionNotifier.NONE, clock);
        broken.close();

        Scheduler mixed = new Scheduler(clock, List.of(brokenQueue, automationQueue));
        try {
            long trigger = triggerStore.create(JobInput.of(new TriggerPayload("automation.x", "user-1")));
            assertEquals(1, mixed.tick());
            assertEquals(JobStatus.DONE, triggerStore.get(trigger).getStatus());
        } finally {
            brokenQueue.shutdown();
        }
    }

    @Test
    public void testQueuesShuttingDownAreSkipped() throws Exception {
        notification("skipped", "now");
        notificationQueue.shutdown();
        assertEquals(0, scheduler.tick());
        assertTrue(executed.isEmpty());
    }

    @Test
    public void testStartTicksImmediately() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        JobQueue<DeliveryPayload> latchedQueue = new JobQueue<>(notificationStore, job -> {
            ran.countDown();
            return null;
        }, new ExponentialBackoff(Duration.ZERO), CompletionNotifier.NONE, clock);
        Scheduler latched = new Scheduler(clock, List.of(latchedQueue));
        try {
            notification("waiting", "now");
            latched.start(3600);
            assertTrue(ran.await(5, TimeUnit.SECONDS), "first tick runs without waiting an interval");
        } finally {
            latched.stop();
            latchedQueue.shutdown();
        }
    }

    @Test
    public void testStartStopLifecycle() {
        assertFalse(scheduler.isActive());
        assertEquals(Scheduler.DEFAULT_INTERVAL_SECONDS, scheduler.getIntervalSeconds());

        scheduler.start(45);
        assertTrue(scheduler.isActive());
        assertEquals(45, scheduler.getIntervalSeconds());

        scheduler.start(10);
        assertEquals(45, scheduler.getIntervalSeconds(), "second start is ignored");

        scheduler.stop();
        assertFalse(scheduler.isActive());
        scheduler.stop();
    }

    @Test
    public void testStartRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.start(0));
        assertThrows(IllegalArgumentException.class, () -> scheduler.start(-5));
        assertFalse(scheduler.isActive());
    }
}
