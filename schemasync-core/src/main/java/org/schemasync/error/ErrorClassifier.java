package org.schemasync.error;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw driver, network, file system and cancellation failures onto {@link ErrorType}.
 */
public final class ErrorClassifier {

    static final String UNEXPECTED = "An unexpected error occurred";

    private ErrorClassifier() {
    }

    public static SchemaSyncException classify(Throwable error) {
        if (error == null) {
            return null;
        }
        if (error instanceof SchemaSyncException classified) {
            return classified;
        }

        // look through the cause chain for the most specific known failure
        for (Throwable current = error; current != null; current = nextCause(current)) {
            SchemaSyncException result = classifyOne(current, error);
            if (result != null) {
                return result;
            }
        }
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof IllegalArgumentException
                    || current instanceof IllegalStateException
                    || current instanceof NullPointerException) {
                return new SchemaSyncException(ErrorType.VALIDATION, messageOf(current), error);
            }
        }
        return new SchemaSyncException(ErrorType.UNKNOWN, UNEXPECTED, error);
    }

    private static Throwable nextCause(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }

    private static SchemaSyncException classifyOne(Throwable current, Throwable original) {
        if (current instanceof SchemaSyncException classified) {
            return classified;
        }
        if (current instanceof SQLException sql) {
            return classifySql(sql, original);
        }
        SchemaSyncException network = classifyNetwork(current, original);
        if (network != null) {
            return network;
        }
        SchemaSyncException deadline = classifyDeadline(current, original);
        if (deadline != null) {
            return deadline;
        }
        return classifyFileSystem(current, original);
    }

    private static SchemaSyncException classifySql(SQLException e, Throwable original) {
        int code = e.getErrorCode();
        SchemaSyncException result = switch (code) {
            case 1045 -> new SchemaSyncException(ErrorType.PERMISSION,
                    "Database access denied - check username and password", original);
            case 1049 -> new SchemaSyncException(ErrorType.VALIDATION, "Database does not exist", original);
            case 1146 -> new SchemaSyncException(ErrorType.SCHEMA, "Table does not exist", original);
            case 1054 -> new SchemaSyncException(ErrorType.SCHEMA, "Column does not exist", original);
            case 1062 -> new SchemaSyncException(ErrorType.VALIDATION, "Duplicate entry - record already exists", original);
            case 1064 -> new SchemaSyncException(ErrorType.SQL, "SQL syntax error", original);
            case 2003 -> SchemaSyncException.recoverable(ErrorType.CONNECTION,
                    "Cannot connect to MySQL server - server may be down or unreachable", original);
            case 2006, 2013 -> SchemaSyncException.recoverable(ErrorType.CONNECTION,
                    "MySQL server connection lost - attempting to reconnect", original);
            default -> classifySqlState(e, original);
        };
        result.withContext("error_code", code);
        if (e.getSQLState() != null) {
            result.withContext("sql_state", e.getSQLState());
        }
        return result;
    }

    private static SchemaSyncException classifySqlState(SQLException e, Throwable original) {
        if (e instanceof SQLTimeoutException) {
            return SchemaSyncException.recoverable(ErrorType.TIMEOUT, "Database operation timed out", original);
        }
        if (e instanceof SQLTransientConnectionException) {
            return SchemaSyncException.recoverable(ErrorType.CONNECTION, "Temporary database connection error", original);
        }
        String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            return SchemaSyncException.recoverable(ErrorType.CONNECTION, "Database connection error", original);
        }
        if (state != null && state.startsWith("28")) {
            return new SchemaSyncException(ErrorType.PERMISSION, "Invalid authorization specification", original);
        }
        return new SchemaSyncException(ErrorType.SQL, "MySQL error: " + messageOf(e), original);
    }

    private static SchemaSyncException classifyNetwork(Throwable e, Throwable original) {
        if (e instanceof SocketTimeoutException) {
            return SchemaSyncException.recoverable(ErrorType.TIMEOUT, "Network operation timed out", original);
        }
        if (e instanceof ConnectException || e instanceof NoRouteToHostException) {
            return SchemaSyncException.recoverable(ErrorType.CONNECTION, "Failed to establish network connection", original);
        }
        if (e instanceof UnknownHostException) {
            return SchemaSyncException.recoverable(ErrorType.CONNECTION, "Unknown host: " + messageOf(e), original);
        }
        if (e instanceof SocketException) {
            return SchemaSyncException.recoverable(ErrorType.CONNECTION, "Network I/O error", original);
        }
        return null;
    }

    private static SchemaSyncException classifyDeadline(Throwable e, Throwable original) {
        if (e instanceof TimeoutException) {
            return SchemaSyncException.recoverable(ErrorType.TIMEOUT, "Operation timed out", original);
        }
        if (e instanceof CancellationException
                || e instanceof InterruptedException
                || e instanceof InterruptedIOException) {
            return new SchemaSyncException(ErrorType.INTERRUPTION, "Operation was canceled", original);
        }
        return null;
    }

    private static SchemaSyncException classifyFileSystem(Throwable e, Throwable original) {
        if (e instanceof NoSuchFileException nsf) {
            return new SchemaSyncException(ErrorType.VALIDATION, "File or directory not found: " + nsf.getFile(), original);
        }
        if (e instanceof AccessDeniedException ad) {
            return new SchemaSyncException(ErrorType.PERMISSION, "Permission denied: " + ad.getFile(), original);
        }
        if (e instanceof FileSystemException fse && fse.getReason() != null
                && fse.getReason().contains("No space left")) {
            return new SchemaSyncException(ErrorType.VALIDATION, "No space left on device", original);
        }
        return null;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
