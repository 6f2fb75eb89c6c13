package com.dispatchqueue.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

// Fixed-size connection pool for the embedded H2 database
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final String DEFAULT_URL = "jdbc:h2:./data/dispatch;AUTO_SERVER=TRUE";
    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;
    private final BlockingQueue<Connection> connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database() {
        this(DEFAULT_URL, "sa", "", 10);
    }

    public Database(String url, String user, String password, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + poolSize);
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);
    }

    // In-memory database that lives until the last connection closes; for tests and dry runs
    public static Database inMemory(String name) {
        return new Database("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1", "sa", "", 4);
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
        try {
            Class.forName("org.h2.Driver");
        } catch (ClassNotFoundException e) {
            throw new SQLException("H2 Driver not found", e);
        }

        for (int i = 0; i < poolSize; i++) {
            connectionPool.offer(createConnection());
        }
        logger.info("Connection pool created with " + poolSize + " connections");

        initializeSchema();

        initialized = true;
        logger.info("Database initialization complete");
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Borrow a connection. Closing the returned connection hands it back to the pool.
     */
    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        try {
            Connection conn = connectionPool.poll(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException("Timeout waiting for available connection");
            }
            if (conn.isClosed() || !conn.isValid(2)) {
                logger.warning("Pooled connection invalid, creating new one");
                conn = createConnection();
            }
            return new PooledConnection(conn, this);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    // Called when a PooledConnection is closed; resets transaction state before pooling
    synchronized void returnConnection(Connection connection) {
        if (connection == null) {
            return;
        }
        if (closed) {
            closeQuietly(connection);
            return;
        }

        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            if (connection.isClosed() || !connection.isValid(2)) {
                logger.warning("Returned connection invalid, creating replacement");
                closeQuietly(connection);
                connection = createConnection();
            }
            if (!connectionPool.offer(connection)) {
                logger.severe("Connection pool full, closing connection");
                closeQuietly(connection);
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error returning connection to pool", e);
            closeQuietly(connection);
        }
    }

    private void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close connection", e);
        }
    }

    // Run schema.sql from the classpath, statement by statement
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException("Schema resource not found on classpath: " + SCHEMA_RESOURCE);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource", e);
        }

        Connection conn = connectionPool.poll();
        if (conn == null) {
            throw new SQLException("No connection available for schema initialization");
        }
        try (Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();
            int executedCount = 0;

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }
                currentStatement.append(line).append(' ');
                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
            logger.info("Schema initialized (" + executedCount + " statements)");
        } finally {
            connectionPool.offer(conn);
        }
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        logger.info("Closing database connections...");
        closed = true;

        int closedCount = 0;
        Connection conn;
        while ((conn = connectionPool.poll()) != null) {
            closeQuietly(conn);
            closedCount++;
        }
        logger.info("Closed " + closedCount + " database connections");
    }
}
