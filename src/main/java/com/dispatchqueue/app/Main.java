package com.dispatchqueue.app;

import com.dispatchqueue.client.HomeAssistantClient;
import com.dispatchqueue.client.WebhookChatClient;
import com.dispatchqueue.core.DeliveryPayload;
import com.dispatchqueue.core.TriggerPayload;
import com.dispatchqueue.db.AutomationTriggerStore;
import com.dispatchqueue.db.Database;
import com.dispatchqueue.db.JobStore;
import com.dispatchqueue.db.NotificationStore;
import com.dispatchqueue.engine.CompletionNotifier;
import com.dispatchqueue.engine.ExponentialBackoff;
import com.dispatchqueue.engine.JobQueue;
import com.dispatchqueue.engine.Scheduler;
import com.dispatchqueue.jobs.AutomationTriggerExecutor;
import com.dispatchqueue.jobs.ChatCompletionNotifier;
import com.dispatchqueue.jobs.MessageDeliveryExecutor;
import com.dispatchqueue.time.TimeResolver;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main application entry point for the dispatch queue.
 * Wires the stores, queues, scheduler, retention sweep and stats endpoint, recovers jobs left
 * mid-flight by the previous run and then runs until the JVM is asked to stop.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    static final String AUTOMATION_SUCCESS_TITLE = "✓ Automation Triggered";
    static final String AUTOMATION_FAILURE_TITLE = "✗ Automation Trigger Failed";

    private static final CountDownLatch stopped = new CountDownLatch(1);

    private static Database database;
    private static JobQueue<DeliveryPayload> notificationQueue;
    private static JobQueue<TriggerPayload> automationQueue;
    private static Scheduler scheduler;
    private static RetentionSweeper retentionSweeper;
    private static StatsServer statsServer;

    public static void main(String[] args) {
        initializeLogging();
        logger.info("=== Dispatch Queue Starting ===");

        try {
            DispatchConfig config = DispatchConfig.load();
            start(config, Clock.systemUTC());
            addShutdownHook();

            logger.info("=== Dispatch Queue is running ===");
            stopped.await();
        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            shutdown();
            System.exit(1);
        }
    }

    /**
     * Bring every component up in dependency order. Recovery runs before the scheduler is armed.
     */
    static void start(DispatchConfig config, Clock clock) throws Exception {
        initializeDatabase(config);
        TimeResolver timeResolver = new TimeResolver(clock);

        List<JobQueue<?>> queues = new ArrayList<>();
        List<JobStore<?>> stores = new ArrayList<>();

        NotificationStore notificationStore = new NotificationStore(database, timeResolver, config.getDefaultMaxRetries());
        notificationQueue = initializeNotificationQueue(config, notificationStore, clock);
        queues.add(notificationQueue);
        stores.add(notificationStore);

        if (config.isAutomationEnabled()) {
            AutomationTriggerStore triggerStore = new AutomationTriggerStore(database, timeResolver, config.getDefaultMaxRetries());
            automationQueue = initializeAutomationQueue(config, triggerStore, clock);
            queues.add(automationQueue);
            stores.add(triggerStore);
        } else {
            logger.info("Automation queue disabled (HA_URL or HA_ACCESS_TOKEN not set)");
        }

        recoverJobs(queues);
        initializeScheduler(config, queues, clock);
        initializeRetention(config, stores, clock);
        initializeStatsServer(config, queues);
    }

    private static void initializeLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load logging.properties, using JDK defaults", e);
        }
    }

    private static void initializeDatabase(DispatchConfig config) throws Exception {
        logger.info("Initializing database...");
        database = new Database(config.getDatabaseUrl(), config.getDatabaseUser(),
                config.getDatabasePassword(), config.getDatabasePoolSize());
        database.initialize();
    }

    private static JobQueue<DeliveryPayload> initializeNotificationQueue(DispatchConfig config,
                                                                         NotificationStore store, Clock clock) {
        String webhookUrl = config.getChatWebhookUrl();
        if (webhookUrl == null) {
            throw new IllegalStateException("CHAT_WEBHOOK_URL (chat.webhookUrl) is required");
        }
        WebhookChatClient chatClient = new WebhookChatClient(webhookUrl, config.getChatTimeoutMillis());
        MessageDeliveryExecutor executor = new MessageDeliveryExecutor(chatClient, config.getChatChannelId());
        logger.info("Notification queue ready");
        return new JobQueue<>(store, executor, new ExponentialBackoff(config.getRetryBaseDelaySeconds()),
                CompletionNotifier.NONE, clock,
                Duration.ofSeconds(config.getExecutionTimeoutSeconds()),
                Duration.ofSeconds(config.getShutdownTimeoutSeconds()));
    }

    private static JobQueue<TriggerPayload> initializeAutomationQueue(DispatchConfig config,
                                                                      AutomationTriggerStore store, Clock clock) {
        HomeAssistantClient haClient = new HomeAssistantClient(config.getHaUrl(), config.getHaAccessToken(),
                config.getHaTimeoutMillis());
        if (!haClient.validateConnection()) {
            logger.warning("Home Assistant at " + haClient.getBaseUrl() + " is not reachable yet, triggers will retry");
        }

        ChatCompletionNotifier notifier = new ChatCompletionNotifier(
                new WebhookChatClient(config.getChatWebhookUrl(), config.getChatTimeoutMillis()),
                config.getChatChannelId(), AUTOMATION_SUCCESS_TITLE, AUTOMATION_FAILURE_TITLE,
                "Home Assistant", clock);
        logger.info("Automation queue ready");
        return new JobQueue<>(store, new AutomationTriggerExecutor(haClient),
                new ExponentialBackoff(config.getRetryBaseDelaySeconds()), notifier, clock,
                Duration.ofSeconds(config.getExecutionTimeoutSeconds()),
                Duration.ofSeconds(config.getShutdownTimeoutSeconds()));
    }

    private static void recoverJobs(List<JobQueue<?>> queues) throws Exception {
        int recovered = 0;
        for (JobQueue<?> queue : queues) {
            recovered += queue.recover();
        }
        if (recovered > 0) {
            logger.info("Recovered " + recovered + " job(s) left processing by the previous run");
        } else {
            logger.info("No stuck jobs to recover");
        }
    }

    private static void initializeScheduler(DispatchConfig config, List<JobQueue<?>> queues, Clock clock) {
        scheduler = new Scheduler(clock, queues);
        scheduler.start(config.getSchedulerIntervalSeconds());
    }

    private static void initializeRetention(DispatchConfig config, List<JobStore<?>> stores, Clock clock) {
        retentionSweeper = new RetentionSweeper(stores, Duration.ofDays(config.getRetentionDoneDays()), clock);
        retentionSweeper.start(Duration.ofHours(config.getRetentionSweepIntervalHours()));
    }

    private static void initializeStatsServer(DispatchConfig config, List<JobQueue<?>> queues) throws IOException {
        int port = config.getStatsPort();
        if (port < 0) {
            logger.info("Stats endpoint disabled");
            return;
        }
        statsServer = new StatsServer(queues, port);
        statsServer.start();
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            shutdown();
            stopped.countDown();
        }, "Shutdown-Hook"));
    }

    /**
     * Stop intake first, then drain the queues, then close the database.
     */
    static synchronized void shutdown() {
        logger.info("=== Dispatch Queue Shutting Down ===");
        if (statsServer != null) {
            statsServer.stop();
            statsServer = null;
        }
        if (scheduler != null) {
            scheduler.stop();
            scheduler = null;
        }
        if (retentionSweeper != null) {
            retentionSweeper.stop();
            retentionSweeper = null;
        }
        if (notificationQueue != null) {
            notificationQueue.shutdown();
            notificationQueue = null;
        }
        if (automationQueue != null) {
            automationQueue.shutdown();
            automationQueue = null;
        }
        if (database != null) {
            database.close();
            database = null;
        }
        logger.info("=== Dispatch Queue Stopped ===");
    }

    static JobQueue<DeliveryPayload> getNotificationQueue() {
        return notificationQueue;
    }

    static JobQueue<TriggerPayload> getAutomationQueue() {
        return automationQueue;
    }

    static Scheduler getScheduler() {
        return scheduler;
    }

    static StatsServer getStatsServer() {
        return statsServer;
    }
}
