package org.schemasync.database;

import lombok.extern.slf4j.Slf4j;
import org.schemasync.error.ErrorClassifier;
import org.schemasync.error.SchemaSyncException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link DatabaseService} on top of {@link DriverManager}. Statements of one {@link #executeSql} call share a
 * transaction that is always committed or rolled back before returning.
 */
@Slf4j
public class JdbcDatabaseService implements DatabaseService {

    static final String PING_FAILED_STATE = "08S01";

    private final Duration statementTimeout;

    public JdbcDatabaseService() {
        this(Duration.ZERO);
    }

    /**
     * @param statementTimeout per-statement query timeout; zero disables it
     */
    public JdbcDatabaseService(Duration statementTimeout) {
        this.statementTimeout = Objects.requireNonNull(statementTimeout, "statementTimeout must not be null");
    }

    @Override
    public Connection connect(DatabaseConfig config) throws SQLException {
        Objects.requireNonNull(config, "config must not be null");
        log.info("Connecting to database {}", config.describe());

        Connection connection = DriverManager.getConnection(config.jdbcUrl(), connectionProperties(config));
        try {
            testConnection(connection, config.effectiveTimeout());
        } catch (SQLException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        log.debug("Connected to {}", config.describe());
        return connection;
    }

    Properties connectionProperties(DatabaseConfig config) {
        Properties props = new Properties();
        if (config.getUsername() != null) {
            props.setProperty("user", config.getUsername());
        }
        if (config.getPassword() != null) {
            props.setProperty("password", config.getPassword());
        }
        // socketTimeout only when given in the connection properties
        props.setProperty("connectTimeout", String.valueOf(config.effectiveTimeout().toMillis()));
        if (config.getProperties() != null) {
            props.putAll(config.getProperties());
        }
        return props;
    }

    @Override
    public void testConnection(Connection connection) throws SQLException {
        testConnection(connection, DatabaseConfig.DEFAULT_TIMEOUT);
    }

    private void testConnection(Connection connection, Duration timeout) throws SQLException {
        requireConnection(connection);
        int seconds = (int) Math.max(1, timeout.toSeconds());
        if (!connection.isValid(seconds)) {
            throw new SQLNonTransientConnectionException("failed to ping database", PING_FAILED_STATE);
        }
        log.debug("Database connection test successful");
    }

    @Override
    public void close(Connection connection) throws SQLException {
        if (connection == null) {
            log.debug("Database connection is null, nothing to close");
            return;
        }
        connection.close();
        log.debug("Database connection closed");
    }

    @Override
    public String getVersion(Connection connection) throws SQLException {
        requireConnection(connection);
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT VERSION()")) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    @Override
    public void executeSql(Connection connection, List<String> statements, Duration timeout) throws SQLException {
        requireConnection(connection);
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (statements == null || statements.isEmpty()) {
            log.debug("No SQL statements to execute");
            return;
        }
        log.info("Executing {} SQL statement(s)", statements.size());
        int queryTimeout = queryTimeoutSeconds(timeout);

        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            for (int i = 0; i < statements.size(); i++) {
                String sql = statements.get(i);
                if (sql == null || sql.isBlank()) {
                    continue;
                }
                executeOne(connection, sql, i, queryTimeout);
            }
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            rollback(connection, e);
            restoreAutoCommit(connection, autoCommit, e);
            throw e;
        }
        connection.setAutoCommit(autoCommit);
    }

    /**
     * Shortest of the configured statement timeout and the caller's bound, in whole seconds (at least 1);
     * 0 when neither is set.
     */
    int queryTimeoutSeconds(Duration timeout) {
        Duration effective = statementTimeout;
        if (!timeout.isZero() && !timeout.isNegative()
                && (effective.isZero() || timeout.compareTo(effective) < 0)) {
            effective = timeout;
        }
        if (effective.isZero() || effective.isNegative()) {
            return 0;
        }
        long seconds = effective.plusMillis(999).toSeconds();
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    /**
     * @throws SchemaSyncException the classified driver error, annotated with the statement and its 1-based index
     */
    private void executeOne(Connection connection, String sql, int index, int queryTimeout) throws SQLException {
        long started = System.nanoTime();
        try (Statement stmt = connection.createStatement()) {
            if (queryTimeout > 0) {
                stmt.setQueryTimeout(queryTimeout);
            }
            stmt.execute(sql);
            log.debug("Executed statement {} in {}ms: {}", index + 1, (System.nanoTime() - started) / 1_000_000, sql);
        } catch (SQLException e) {
            log.error("SQL execution failed at statement {}: {}", index + 1, e.getMessage());
            throw ErrorClassifier.classify(e)
                    .withContext("statement", sql)
                    .withContext("statement_index", index + 1);
        }
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            log.error("Failed to rollback transaction", rollbackError);
            cause.addSuppressed(rollbackError);
        }
    }

    private void restoreAutoCommit(Connection connection, boolean autoCommit, Exception cause) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException restoreError) {
            log.warn("Failed to restore auto-commit after a failed execution: {}", restoreError.getMessage());
            cause.addSuppressed(restoreError);
        }
    }

    private void closeAfterFailure(Connection connection, Exception cause) {
        try {
            connection.close();
        } catch (SQLException closeError) {
            cause.addSuppressed(closeError);
        }
    }

    private static void requireConnection(Connection connection) {
        if (connection == null) {
            throw SchemaSyncException.validation("database connection is null");
        }
    }
}
