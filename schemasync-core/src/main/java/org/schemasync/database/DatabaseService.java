package org.schemasync.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Database access capability. The sync pipeline only talks to a server through this interface.
 */
public interface DatabaseService {

    Connection connect(DatabaseConfig config) throws SQLException;

    void testConnection(Connection connection) throws SQLException;

    void close(Connection connection) throws SQLException;

    String getVersion(Connection connection) throws SQLException;

    /**
     * Executes the statements in order. Either all of them take effect or the failure is reported after the
     * open transaction has been rolled back.
     *
     * @param timeout upper bound for each statement; zero means no bound
     */
    void executeSql(Connection connection, List<String> statements, Duration timeout) throws SQLException;

    default void executeSql(Connection connection, List<String> statements) throws SQLException {
        executeSql(connection, statements, Duration.ZERO);
    }
}
