package org.schemasync.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JdbcDatabaseServiceTest {

    @Mock
    private Connection connection;
    @Mock
    private Statement statement;

    private final JdbcDatabaseService service = new JdbcDatabaseService();

    @Test
    @DisplayName("Statements run in one transaction that is committed")
    void commits() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);

        service.executeSql(connection, List.of("CREATE TABLE a (id INT)", "CREATE TABLE b (id INT)"));

        InOrder inOrder = inOrder(connection, statement);
        inOrder.verify(connection).setAutoCommit(false);
        inOrder.verify(statement).execute("CREATE TABLE a (id INT)");
        inOrder.verify(statement).execute("CREATE TABLE b (id INT)");
        inOrder.verify(connection).commit();
        inOrder.verify(connection).setAutoCommit(true);
        verify(connection, never()).rollback();
        verify(statement, times(2)).close();
    }

    @Test
    @DisplayName("A failing statement rolls back and carries its statement and 1-based index")
    void rollsBack() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("DROP TABLE missing")).thenThrow(new SQLException("Unknown table", "42S02", 1051));

        SchemaSyncException ex = catchThrowableOfType(() ->
                service.executeSql(connection, List.of("CREATE TABLE a (id INT)", "DROP TABLE missing")),
                SchemaSyncException.class);

        assertThat(ex.getType()).isEqualTo(ErrorType.SQL);
        assertThat(ex.getContext())
                .containsEntry("statement", "DROP TABLE missing")
                .containsEntry("statement_index", 2)
                .containsEntry("error_code", 1051);
        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).setAutoCommit(true);
    }

    @Test
    @DisplayName("A rollback failure is attached to the original error")
    void rollbackFailureSuppressed() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(false);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("BROKEN")).thenThrow(new SQLException("syntax", "42000", 1064));
        doThrow(new SQLException("connection lost")).when(connection).rollback();

        SchemaSyncException ex = catchThrowableOfType(
                () -> service.executeSql(connection, List.of("BROKEN")), SchemaSyncException.class);

        assertThat(ex.getSuppressed()).hasSize(1);
        verify(connection, times(2)).setAutoCommit(false);
    }

    @Test
    @DisplayName("A failing auto-commit restore keeps the statement error and its context")
    void autoCommitRestoreFailureSuppressed() throws SQLException {
        SQLException closed = new SQLNonTransientConnectionException(
                "No operations allowed after connection closed.", "08003");
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("ALTER TABLE `users` ADD COLUMN `email` VARCHAR(255)"))
                .thenThrow(new SQLException("Lost connection to MySQL server during query", "08S01", 2013));
        doNothing().doThrow(closed).when(connection).setAutoCommit(anyBoolean());

        SchemaSyncException ex = catchThrowableOfType(() -> service.executeSql(connection,
                List.of("ALTER TABLE `users` ADD COLUMN `email` VARCHAR(255)")), SchemaSyncException.class);

        assertThat(ex.getType()).isEqualTo(ErrorType.CONNECTION);
        assertThat(ex.getContext())
                .containsEntry("statement_index", 1)
                .containsEntry("error_code", 2013);
        assertThat(ex.getSuppressed()).contains(closed);
    }

    @Test
    @DisplayName("Blank statements are skipped; an empty list does nothing")
    void blanksAndEmpty() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);

        service.executeSql(connection, Arrays.asList(" ", null, "SELECT 1"));
        verify(statement, times(1)).execute(anyString());

        Connection untouched = mock(Connection.class);
        service.executeSql(untouched, List.of());
        verifyNoInteractions(untouched);
    }

    @Test
    @DisplayName("Statement timeout is applied when configured")
    void statementTimeout() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);

        new JdbcDatabaseService(Duration.ofSeconds(15)).executeSql(connection, List.of("SELECT 1"));

        verify(statement).setQueryTimeout(15);
    }

    @Test
    @DisplayName("The caller's bound becomes the query timeout when it is the shorter one")
    void callerTimeoutApplied() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);

        new JdbcDatabaseService(Duration.ofMinutes(5))
                .executeSql(connection, List.of("SELECT 1"), Duration.ofMillis(2500));

        verify(statement).setQueryTimeout(3);
    }

    @Test
    @DisplayName("No query timeout is set when neither bound is given")
    void noTimeout() throws SQLException {
        when(connection.getAutoCommit()).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);

        service.executeSql(connection, List.of("SELECT 1"), Duration.ZERO);

        verify(statement, never()).setQueryTimeout(anyInt());
    }

    @Test
    @DisplayName("Query timeout is the shorter bound, rounded up to whole seconds")
    void queryTimeoutSeconds() {
        JdbcDatabaseService bounded = new JdbcDatabaseService(Duration.ofSeconds(20));

        assertThat(service.queryTimeoutSeconds(Duration.ZERO)).isZero();
        assertThat(service.queryTimeoutSeconds(Duration.ofMillis(1))).isEqualTo(1);
        assertThat(service.queryTimeoutSeconds(Duration.ofSeconds(90))).isEqualTo(90);
        assertThat(bounded.queryTimeoutSeconds(Duration.ZERO)).isEqualTo(20);
        assertThat(bounded.queryTimeoutSeconds(Duration.ofSeconds(90))).isEqualTo(20);
        assertThat(bounded.queryTimeoutSeconds(Duration.ofMillis(4200))).isEqualTo(5);
    }

    @Test
    @DisplayName("Connect timeout is passed to the driver without a socket read timeout")
    void connectionProperties() {
        DatabaseConfig config = DatabaseConfig.builder()
                .host("localhost").username("root").password("secret").database("app")
                .timeout(Duration.ofSeconds(10))
                .properties(Map.of("useSSL", "false"))
                .build();

        Properties props = service.connectionProperties(config);

        assertThat(props)
                .containsEntry("user", "root")
                .containsEntry("password", "secret")
                .containsEntry("connectTimeout", "10000")
                .containsEntry("useSSL", "false")
                .doesNotContainKey("socketTimeout");
    }

    @Test
    @DisplayName("An explicit socketTimeout property is passed through")
    void explicitSocketTimeout() {
        DatabaseConfig config = DatabaseConfig.builder()
                .host("localhost").database("app")
                .properties(Map.of("socketTimeout", "600000"))
                .build();

        assertThat(service.connectionProperties(config)).containsEntry("socketTimeout", "600000");
    }

    @Test
    @DisplayName("A null connection is a validation error")
    void nullConnection() {
        SchemaSyncException ex = catchThrowableOfType(
                () -> service.executeSql(null, List.of("SELECT 1")), SchemaSyncException.class);

        assertThat(ex).hasMessage("database connection is null");
        assertThat(ex.getType()).isEqualTo(ErrorType.VALIDATION);
    }

    @Test
    @DisplayName("Ping failure reports a connection error")
    void pingFailure() throws SQLException {
        when(connection.isValid(anyInt())).thenReturn(false);

        SQLException ex = catchThrowableOfType(() -> service.testConnection(connection), SQLException.class);

        assertThat(ex.getSQLState()).isEqualTo("08S01");
    }

    @Test
    @DisplayName("Version is read with SELECT VERSION()")
    void version() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SELECT VERSION()")).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("8.0.36");

        assertThat(service.getVersion(connection)).isEqualTo("8.0.36");
    }

    @Test
    @DisplayName("Closing a null connection is a no-op")
    void closeNull() {
        assertThatCode(() -> service.close(null)).doesNotThrowAnyException();
    }
}
