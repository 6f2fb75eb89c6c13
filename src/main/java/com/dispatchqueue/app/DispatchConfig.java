package com.dispatchqueue.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Runtime settings, resolved in three layers (later wins):
 * <ol>
 *   <li>{@code dispatch.properties} on the classpath</li>
 *   <li>the file named by the {@code dispatch.config} system property, if set</li>
 *   <li>environment variables ({@code DATABASE_URL}, {@code QUEUE_RETRY_BASE_DELAY}, ...)</li>
 * </ol>
 * Numeric values are checked on access; a malformed number fails fast with
 * {@link IllegalArgumentException} naming the key.
 */
public class DispatchConfig {
    private static final Logger logger = Logger.getLogger(DispatchConfig.class.getName());

    public static final String RESOURCE = "dispatch.properties";
    public static final String CONFIG_FILE_PROPERTY = "dispatch.config";

    // Environment variable -> property key
    static final Map<String, String> ENV_OVERRIDES = new LinkedHashMap<>();

    static {
        ENV_OVERRIDES.put("DATABASE_URL", "db.url");
        ENV_OVERRIDES.put("QUEUE_RETRY_BASE_DELAY", "queue.retryBaseDelaySeconds");
        ENV_OVERRIDES.put("QUEUE_SCHEDULER_INTERVAL", "queue.schedulerIntervalSeconds");
        ENV_OVERRIDES.put("QUEUE_MAX_RETRIES", "queue.maxRetries");
        ENV_OVERRIDES.put("QUEUE_EXECUTION_TIMEOUT", "queue.executionTimeoutSeconds");
        ENV_OVERRIDES.put("STATS_PORT", "stats.port");
        ENV_OVERRIDES.put("CHAT_WEBHOOK_URL", "chat.webhookUrl");
        ENV_OVERRIDES.put("CHAT_CHANNEL_ID", "chat.channelId");
        ENV_OVERRIDES.put("HA_URL", "ha.url");
        ENV_OVERRIDES.put("HA_ACCESS_TOKEN", "ha.accessToken");
        ENV_OVERRIDES.put("HA_TIMEOUT", "ha.timeoutMillis");
        ENV_OVERRIDES.put("RETENTION_DONE_DAYS", "retention.doneDays");
    }

    private final Properties properties;

    DispatchConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load from the classpath resource, the optional override file and the process environment.
     *
     * @throws IOException if the override file cannot be read
     */
    public static DispatchConfig load() throws IOException {
        return load(System.getProperty(CONFIG_FILE_PROPERTY), System::getenv);
    }

    static DispatchConfig load(String overrideFile, Function<String, String> env) throws IOException {
        Properties properties = new Properties();

        try (InputStream in = DispatchConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.warning(RESOURCE + " not found on classpath, using built-in defaults");
            }
        }

        if (overrideFile != null && !overrideFile.isBlank()) {
            try (Reader reader = Files.newBufferedReader(Path.of(overrideFile), StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            logger.info("Loaded configuration overrides from " + overrideFile);
        }

        return fromProperties(properties, env);
    }

    static DispatchConfig fromProperties(Properties base, Function<String, String> env) {
        Properties properties = new Properties();
        properties.putAll(base);
        for (Map.Entry<String, String> override : ENV_OVERRIDES.entrySet()) {
            String value = env.apply(override.getKey());
            if (value != null && !value.isBlank()) {
                properties.setProperty(override.getValue(), value.trim());
            }
        }
        return new DispatchConfig(properties);
    }

    // Database

    public String getDatabaseUrl() {
        return getString("db.url", "jdbc:h2:./data/dispatch;AUTO_SERVER=TRUE");
    }

    public String getDatabaseUser() {
        return getString("db.user", "sa");
    }

    public String getDatabasePassword() {
        return getString("db.password", "");
    }

    public int getDatabasePoolSize() {
        return getPositiveInt("db.poolSize", 10);
    }

    // Queue engine

    public long getRetryBaseDelaySeconds() {
        return getNonNegativeLong("queue.retryBaseDelaySeconds", 60);
    }

    public long getSchedulerIntervalSeconds() {
        return getPositiveInt("queue.schedulerIntervalSeconds", 30);
    }

    public int getDefaultMaxRetries() {
        return (int) getNonNegativeLong("queue.maxRetries", 3);
    }

    public long getExecutionTimeoutSeconds() {
        return getNonNegativeLong("queue.executionTimeoutSeconds", 30);
    }

    public long getShutdownTimeoutSeconds() {
        return getNonNegativeLong("queue.shutdownTimeoutSeconds", 60);
    }

    // Stats endpoint; a negative port disables it

    public int getStatsPort() {
        return getInt("stats.port", 8080);
    }

    // Chat delivery

    public String getChatWebhookUrl() {
        return getString("chat.webhookUrl", null);
    }

    public String getChatChannelId() {
        return getString("chat.channelId", null);
    }

    public int getChatTimeoutMillis() {
        return getPositiveInt("chat.timeoutMillis", 10_000);
    }

    // Home automation

    public String getHaUrl() {
        return getString("ha.url", null);
    }

    public String getHaAccessToken() {
        return getString("ha.accessToken", null);
    }

    public int getHaTimeoutMillis() {
        return getPositiveInt("ha.timeoutMillis", 10_000);
    }

    public boolean isAutomationEnabled() {
        return getHaUrl() != null && getHaAccessToken() != null;
    }

    // Retention

    public int getRetentionDoneDays() {
        return getPositiveInt("retention.doneDays", 30);
    }

    public int getRetentionSweepIntervalHours() {
        return getPositiveInt("retention.sweepIntervalHours", 24);
    }

    private String getString(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private int getInt(String key, int defaultValue) {
        long value = getLong(key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Configuration value out of range for " + key + ": " + value);
        }
        return (int) value;
    }

    private int getPositiveInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException("Configuration value for " + key + " must be positive, got " + value);
        }
        return value;
    }

    private long getNonNegativeLong(String key, long defaultValue) {
        long value = getLong(key, defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException("Configuration value for " + key + " must be >= 0, got " + value);
        }
        return value;
    }

    private long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }
}
