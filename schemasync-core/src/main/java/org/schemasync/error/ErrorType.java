package org.schemasync.error;

import java.util.List;

/**
 * Classification of failures, independent of the exception class that carried them.
 */
public enum ErrorType {
    CONNECTION(List.of(
            "Check that the database server is running",
            "Verify the host and port are correct",
            "Ensure network connectivity to the database server",
            "Check firewall settings")),
    SQL(List.of(
            "Review the SQL statements being executed",
            "Check for syntax errors or unsupported features",
            "Verify database permissions for schema modifications")),
    SCHEMA(List.of(
            "Re-extract both schemas and compare again",
            "Check that referenced tables and columns exist on the target")),
    VALIDATION(List.of(
            "Check that the database names are correct",
            "Verify that the databases exist",
            "Review the command line arguments")),
    PERMISSION(List.of(
            "Verify the username and password are correct",
            "Check that the user has the required permissions",
            "Ensure the user can connect from your host")),
    TIMEOUT(List.of(
            "The operation may be taking longer than expected",
            "Try increasing the timeout value",
            "Check database server performance")),
    INTERRUPTION(List.of()),
    UNKNOWN(List.of());

    private final List<String> troubleshooting;

    ErrorType(List<String> troubleshooting) {
        this.troubleshooting = troubleshooting;
    }

    /**
     * Short hints shown to the user next to the error message. May be empty.
     */
    public List<String> troubleshooting() {
        return troubleshooting;
    }
}
