package de.bsommerfeld.notes.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.notes.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns connectivity to the notes database: database lifecycle, schema and
 * the unit of work every repository call runs in.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed before the
 * operation returns. No session outlives a call, so a failed save cannot leave
 * pending state behind for the next one. Pooling is left to the deployment.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #persist} runs its work with auto-commit off and commits once;
 * any {@link SQLException} rolls the transaction back and is reported as a
 * {@link SaveResult}. {@link #query} runs in auto-commit and rethrows
 * failures as {@link DatabaseException}.
 *
 * <h3>Vendor statements</h3>
 * Creating, selecting and dropping the database differs between MySQL and
 * H2 (which models databases as schemas), so those statements are loaded from
 * {@code sql/<vendor>/}. The shared DDL lives in {@code sql/schema.sql}.
 */
@Singleton
public class DatabaseManager {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseManager.class);

    private final DatabaseConfig config;

    @Inject
    public DatabaseManager(DatabaseConfig config) {
        this.config = config;
    }

    Connection openServerConnection() throws SQLException {
        return DriverManager.getConnection(config.serverUrl(), config.user(), config.password());
    }

    /**
     * Opens a connection with the notes database selected. The caller owns
     * the connection and must close it.
     */
    Connection openSession() throws SQLException {
        Connection conn = openServerConnection();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(vendorSql("use-database"));
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /**
     * Creates the database if it does not exist yet and selects it.
     */
    public void createDatabase() {
        try (Connection conn = openServerConnection();
                Statement stmt = conn.createStatement()) {
            createAndSelect(stmt);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to create database " + config.databaseName(), e);
        }
    }

    /**
     * Creates the database and every table that does not exist yet. Safe to
     * call repeatedly; existing tables and their rows are left untouched.
     */
    public void initializeSchema() {
        LOG.info("Initializing database {} at {}", config.databaseName(), config.serverUrl());
        try (Connection conn = openServerConnection()) {
            try (Statement stmt = conn.createStatement()) {
                createAndSelect(stmt);
            }
            applySchema(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Database initialization failed", e);
        }
    }

    /**
     * Drops the database with all tables and rows. Irreversible.
     */
    public void dropDatabase() {
        try (Connection conn = openServerConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute(vendorSql("drop-database"));
            LOG.info("Dropped database {}", config.databaseName());
        } catch (SQLException e) {
            throw new DatabaseException("Failed to drop database " + config.databaseName(), e);
        }
    }

    private void createAndSelect(Statement stmt) throws SQLException {
        stmt.execute(vendorSql("create-database"));
        stmt.execute(vendorSql("use-database"));
    }

    /**
     * Applies {@code sql/schema.sql}, one statement at a time. Every statement
     * is {@code CREATE TABLE IF NOT EXISTS}, which is what makes
     * {@link #initializeSchema()} idempotent.
     */
    private void applySchema(Connection conn) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.load("schema").split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            rollback(conn, e);
            throw e;
        }
    }

    /**
     * Rolls back without letting a rollback failure mask {@code cause}; the
     * rollback error is attached to it as suppressed.
     */
    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private String vendorSql(String name) {
        return String.format(SqlLoader.load(config.vendor(), name), config.databaseName());
    }

    // =====================================================================
    // Unit of Work
    // =====================================================================

    /**
     * Runs {@code work} in its own transaction and commits it. On failure the
     * transaction is rolled back, the error is logged, and the returned result
     * says why; nothing is thrown.
     */
    public <T> SaveResult<T> persist(SqlWork<T> work) {
        try (Connection conn = openSession()) {
            conn.setAutoCommit(false);
            try {
                T saved = work.execute(conn);
                conn.commit();
                return SaveResult.saved(saved);
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            SaveResult<T> failure = SaveResult.failed(e);
            LOG.error("Failed to persist record ({})", failure.status(), e);
            return failure;
        }
    }

    /**
     * Runs read-only {@code work} on a fresh session.
     *
     * @throws DatabaseException wrapping any {@link SQLException}
     */
    public <T> T query(SqlWork<T> work) {
        try (Connection conn = openSession()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Query failed: " + e.getMessage(), e);
        }
    }
}
