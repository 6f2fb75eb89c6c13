package com.dispatchqueue.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseTest {

    private Database database;

    @BeforeEach
    public void setUp() throws SQLException {
        database = Database.inMemory("pool-" + UUID.randomUUID());
        database.initialize();
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    private static long count(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    public void testSchemaIsCreated() throws SQLException {
        try (Connection conn = database.getConnection()) {
            assertEquals(0, count(conn, "notifications"));
            assertEquals(0, count(conn, "automation_triggers"));
        }
    }

    @Test
    public void testClosingReturnsConnectionToPool() throws SQLException {
        // Far more borrows than the pool holds; each close must hand the connection back
        for (int i = 0; i < 20; i++) {
            try (Connection conn = database.getConnection()) {
                assertFalse(conn.isClosed());
                assertTrue(conn.isValid(1));
            }
        }

        List<Connection> borrowed = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            borrowed.add(database.getConnection());
        }
        for (Connection conn : borrowed) {
            conn.close();
        }
    }

    @Test
    public void testReleasedConnectionRejectsUse() throws SQLException {
        Connection conn = database.getConnection();
        conn.close();
        conn.close();

        assertTrue(conn.isClosed());
        assertFalse(conn.isValid(1));
        SQLException error = assertThrows(SQLException.class, conn::createStatement);
        assertEquals("Connection already returned to pool", error.getMessage());
    }

    @Test
    public void testOpenTransactionIsRolledBackOnReturn() throws SQLException {
        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("INSERT INTO notifications (source, message, created_at, scheduled_for, status, "
                        + "retry_count, max_retries) VALUES ('s', 'm', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP, "
                        + "'PENDING', 0, 3)");
            }
        }

        // Every pooled connection must come back in auto-commit mode with nothing pending
        for (int i = 0; i < 4; i++) {
            try (Connection conn = database.getConnection()) {
                assertTrue(conn.getAutoCommit());
                assertEquals(0, count(conn, "notifications"));
            }
        }
    }

    @Test
    public void testUnwrapReachesDriverConnection() throws SQLException {
        try (Connection conn = database.getConnection()) {
            assertTrue(conn.isWrapperFor(org.h2.jdbc.JdbcConnection.class));
            assertNotNull(conn.unwrap(org.h2.jdbc.JdbcConnection.class));
        }
    }

    @Test
    public void testGetConnectionAfterCloseFails() {
        database.close();
        SQLException error = assertThrows(SQLException.class, database::getConnection);
        assertEquals("Database has been closed", error.getMessage());
    }

    @Test
    public void testGetConnectionBeforeInitializeFails() {
        Database fresh = Database.inMemory("uninitialized-" + UUID.randomUUID());
        assertThrows(SQLException.class, fresh::getConnection);
    }
}
