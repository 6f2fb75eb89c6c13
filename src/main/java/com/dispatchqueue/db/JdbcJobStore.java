package com.dispatchqueue.db;

import com.dispatchqueue.core.JobInput;
import com.dispatchqueue.core.JobPayload;
import com.dispatchqueue.core.JobRecord;
import com.dispatchqueue.core.JobStatus;
import com.dispatchqueue.core.QueueStats;
import com.dispatchqueue.core.ValidationException;
import com.dispatchqueue.time.TimeResolver;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SQL shared by both job tables.
 *
 * <p>Subclasses name the table, list their payload columns and translate the payload to and
 * from a row. Everything about the lifecycle columns (status, retries, timestamps) lives
 * here. All methods use PreparedStatement and try-with-resources.</p>
 *
 * @param <P> the payload flavor
 */
public abstract class JdbcJobStore<P extends JobPayload> implements JobStore<P> {
    private static final Logger logger = Logger.getLogger(JdbcJobStore.class.getName());

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    protected final Database database;
    protected final TimeResolver timeResolver;
    protected final int defaultMaxRetries;
    protected final Clock clock;

    protected JdbcJobStore(Database database, TimeResolver timeResolver, int defaultMaxRetries) {
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("Default max retries must be >= 0, got " + defaultMaxRetries);
        }
        this.database = database;
        this.timeResolver = timeResolver;
        this.defaultMaxRetries = defaultMaxRetries;
        this.clock = timeResolver.getClock();
    }

    // Table holding this flavor's rows
    protected abstract String tableName();

    // Payload columns in insert order
    protected abstract List<String> payloadColumns();

    // Reject payloads missing required fields
    protected abstract void validate(P payload);

    /**
     * Bind the payload columns starting at {@code startIndex}, in {@link #payloadColumns()} order.
     */
    protected abstract void bindPayload(PreparedStatement stmt, int startIndex, P payload) throws SQLException;

    protected abstract P mapPayload(ResultSet rs) throws SQLException;

    @Override
    public long create(JobInput<P> input) throws SQLException {
        if (input == null || input.getPayload() == null) {
            throw new ValidationException("payload", "Job payload is required");
        }
        validate(input.getPayload());

        int maxRetries = input.getMaxRetries() != null ? input.getMaxRetries() : defaultMaxRetries;
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries", "maxRetries must be >= 0, got " + maxRetries);
        }

        Instant now = clock.instant();
        Instant scheduledFor = input.hasScheduleExpression()
                ? timeResolver.resolve(input.getScheduleExpression())
                : (input.getScheduledAt() != null ? input.getScheduledAt() : now);

        List<String> columns = new ArrayList<>(payloadColumns());
        columns.add("created_at");
        columns.add("scheduled_for");
        columns.add("status");
        columns.add("retry_count");
        columns.add("max_retries");

        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        String sql = "INSERT INTO " + tableName() + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            int index = payloadColumns().size() + 1;
            bindPayload(stmt, 1, input.getPayload());
            setInstant(stmt, index++, now);
            setInstant(stmt, index++, scheduledFor);
            stmt.setString(index++, JobStatus.PENDING.name());
            stmt.setInt(index++, 0);
            stmt.setInt(index, maxRetries);

            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for new " + getName() + " job");
                }
                long id = keys.getLong(1);
                logger.info("Created " + getName() + " job " + id + " (" + input.getPayload().describe()
                        + "), scheduled for " + scheduledFor);
                return id;
            }
        }
    }

    @Override
    public JobRecord<P> get(long id) throws SQLException {
        String sql = "SELECT * FROM " + tableName() + " WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapRecord(rs);
                }
            }
        }
        return null;
    }

    @Override
    public void setStatus(long id, JobStatus status, String error) throws SQLException {
        String sql = "UPDATE " + tableName() + " SET status = ?, last_error = ?, executed_at = ? WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setString(2, error);
            setInstant(stmt, 3, status == JobStatus.DONE ? clock.instant() : null);
            stmt.setLong(4, id);

            if (stmt.executeUpdate() == 0) {
                logger.warning("No " + getName() + " job found with id " + id);
            } else {
                logger.fine("Set " + getName() + " job " + id + " to " + status);
            }
        }
    }

    @Override
    public boolean transition(long id, JobStatus expected, JobStatus status, String error) throws SQLException {
        if (!expected.canTransitionTo(status)) {
            throw new IllegalArgumentException("Illegal status transition " + expected.name() + " -> " + status.name());
        }
        String sql = "UPDATE " + tableName() + " SET status = ?, last_error = ?, executed_at = ? "
                + "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setString(2, error);
            setInstant(stmt, 3, status == JobStatus.DONE ? clock.instant() : null);
            stmt.setLong(4, id);
            stmt.setString(5, expected.name());

            return stmt.executeUpdate() > 0;
        }
    }

    @Override
    public boolean markDone(long id, String receipt) throws SQLException {
        String sql = "UPDATE " + tableName() + " SET status = ?, executed_at = ?, receipt = ?, last_error = NULL "
                + "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.DONE.name());
            setInstant(stmt, 2, clock.instant());
            stmt.setString(3, receipt);
            stmt.setLong(4, id);
            stmt.setString(5, JobStatus.PROCESSING.name());

            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Increment and read back the retry count inside one SERIALIZABLE transaction.
     */
    @Override
    public int incrementRetry(long id) throws SQLException {
        try (Connection conn = database.getConnection()) {
            int previousIsolation = conn.getTransactionIsolation();
            conn.setAutoCommit(false);
            conn.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            try {
                try (PreparedStatement update = conn.prepareStatement(
                        "UPDATE " + tableName() + " SET retry_count = retry_count + 1 WHERE id = ?")) {
                    update.setLong(1, id);
                    if (update.executeUpdate() == 0) {
                        throw new SQLException("Job not found: " + id);
                    }
                }

                int newCount;
                try (PreparedStatement select = conn.prepareStatement(
                        "SELECT retry_count FROM " + tableName() + " WHERE id = ?")) {
                    select.setLong(1, id);
                    try (ResultSet rs = select.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Job not found after update: " + id);
                        }
                        newCount = rs.getInt("retry_count");
                    }
                }

                conn.commit();
                logger.fine("Incremented retry count for " + getName() + " job " + id + " to " + newCount);
                return newCount;
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
                conn.setTransactionIsolation(previousIsolation);
            }
        }
    }

    @Override
    public boolean scheduleRetry(long id, Instant nextAttempt, String error) throws SQLException {
        String sql = "UPDATE " + tableName() + " SET status = ?, scheduled_for = ?, last_error = ?, executed_at = NULL "
                + "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            setInstant(stmt, 2, nextAttempt);
            stmt.setString(3, error);
            stmt.setLong(4, id);
            stmt.setString(5, JobStatus.PROCESSING.name());

            return stmt.executeUpdate() > 0;
        }
    }

    @Override
    public List<JobRecord<P>> queryDue(Instant cutoff) throws SQLException {
        String sql = "SELECT * FROM " + tableName() + " WHERE status = ? AND scheduled_for <= ? "
                + "ORDER BY scheduled_for ASC, id ASC";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            setInstant(stmt, 2, cutoff);
            return mapAll(stmt);
        }
    }

    @Override
    public List<JobRecord<P>> queryByStatus(JobStatus status, int limit) throws SQLException {
        String order = status == JobStatus.FAILED ? "DESC" : "ASC";
        String sql = "SELECT * FROM " + tableName() + " WHERE status = ? "
                + "ORDER BY created_at " + order + ", id " + order + " LIMIT ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setInt(2, limit);
            return mapAll(stmt);
        }
    }

    @Override
    public List<JobRecord<P>> queryScheduled(Instant after, int limit) throws SQLException {
        String sql = "SELECT * FROM " + tableName() + " WHERE status = ? AND scheduled_for > ? "
                + "ORDER BY scheduled_for ASC, id ASC LIMIT ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            setInstant(stmt, 2, after);
            stmt.setInt(3, limit);
            return mapAll(stmt);
        }
    }

    @Override
    public List<JobRecord<P>> queryHistory(JobStatus status, int limit) throws SQLException {
        String where = status != null ? " WHERE status = ?" : "";
        String sql = "SELECT * FROM " + tableName() + where + " ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int index = 1;
            if (status != null) {
                stmt.setString(index++, status.name());
            }
            stmt.setInt(index, limit);
            return mapAll(stmt);
        }
    }

    @Override
    public boolean cancel(long id) throws SQLException {
        String sql = "UPDATE " + tableName() + " SET status = ?, executed_at = NULL WHERE id = ? AND status IN (?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.CANCELLED.name());
            stmt.setLong(2, id);
            stmt.setString(3, JobStatus.PENDING.name());
            stmt.setString(4, JobStatus.PROCESSING.name());

            boolean cancelled = stmt.executeUpdate() > 0;
            if (cancelled) {
                logger.info("Cancelled " + getName() + " job " + id);
            }
            return cancelled;
        }
    }

    @Override
    public boolean retryNow(long id) throws SQLException {
        String sql = "UPDATE " + tableName() + " SET status = ?, retry_count = 0, last_error = NULL, executed_at = NULL "
                + "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            stmt.setLong(2, id);
            stmt.setString(3, JobStatus.FAILED.name());

            boolean reset = stmt.executeUpdate() > 0;
            if (reset) {
                logger.info("Reset failed " + getName() + " job " + id + " for retry");
            }
            return reset;
        }
    }

    @Override
    public QueueStats stats(Instant now) throws SQLException {
        String sql = "SELECT "
                + "SUM(CASE WHEN status = 'PENDING' AND scheduled_for <= ? THEN 1 ELSE 0 END) AS pending, "
                + "SUM(CASE WHEN status = 'PROCESSING' THEN 1 ELSE 0 END) AS processing, "
                + "SUM(CASE WHEN status = 'PENDING' AND scheduled_for > ? THEN 1 ELSE 0 END) AS scheduled_future, "
                + "SUM(CASE WHEN status = 'FAILED' THEN 1 ELSE 0 END) AS failed, "
                + "SUM(CASE WHEN status = 'DONE' AND executed_at >= ? THEN 1 ELSE 0 END) AS done_recent "
                + "FROM " + tableName();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            setInstant(stmt, 1, now);
            setInstant(stmt, 2, now);
            setInstant(stmt, 3, now.minus(RECENT_WINDOW));

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return new QueueStats(0, 0, 0, 0, 0);
                }
                // SUM over an empty table is NULL, which getLong reads as 0
                return new QueueStats(
                        rs.getLong("pending"),
                        rs.getLong("processing"),
                        rs.getLong("scheduled_future"),
                        rs.getLong("failed"),
                        rs.getLong("done_recent"));
            }
        }
    }

    @Override
    public int deleteDoneBefore(Instant cutoff) throws SQLException {
        String sql = "DELETE FROM " + tableName() + " WHERE status = ? AND executed_at < ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.DONE.name());
            setInstant(stmt, 2, cutoff);

            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                logger.info("Deleted " + deleted + " done " + getName() + " jobs executed before " + cutoff);
            }
            return deleted;
        }
    }

    private List<JobRecord<P>> mapAll(PreparedStatement stmt) throws SQLException {
        List<JobRecord<P>> jobs = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRecord(rs));
            }
        }
        return jobs;
    }

    private JobRecord<P> mapRecord(ResultSet rs) throws SQLException {
        JobRecord<P> job = new JobRecord<>();
        job.setId(rs.getLong("id"));
        job.setCreatedAt(getInstant(rs, "created_at"));
        job.setScheduledFor(getInstant(rs, "scheduled_for"));
        job.setExecutedAt(getInstant(rs, "executed_at"));
        job.setStatus(JobStatus.valueOf(rs.getString("status")));
        job.setRetryCount(rs.getInt("retry_count"));
        job.setMaxRetries(rs.getInt("max_retries"));
        job.setLastError(rs.getString("last_error"));
        job.setReceipt(rs.getString("receipt"));
        job.setPayload(mapPayload(rs));
        return job;
    }

    private void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            logger.log(Level.WARNING, "Rollback failed", rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }

    protected static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, instant.atOffset(ZoneOffset.UTC));
        }
    }

    protected static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    protected static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
    }
}
