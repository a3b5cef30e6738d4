package org.schemasync.database;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.schemasync.error.SchemaSyncException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection settings for one database role (source or target).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseConfig {
    public static final int DEFAULT_PORT = 3306;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private String host;
    @Builder.Default private int port = DEFAULT_PORT;
    private String username;
    @ToString.Exclude private String password;
    private String database;
    /** Full JDBC URL; when set it replaces host, port and database in {@link #jdbcUrl()}. */
    private String url;
    @Builder.Default private Duration timeout = DEFAULT_TIMEOUT;
    @Builder.Default private Map<String, String> properties = new LinkedHashMap<>();

    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return "jdbc:mysql://" + host + ":" + port + "/" + database;
    }

    /**
     * @throws SchemaSyncException VALIDATION listing every missing setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        boolean explicitUrl = url != null && !url.isBlank();
        if (!explicitUrl) {
            if (host == null || host.isBlank()) {
                errors.add("host is required");
            }
            if (port <= 0 || port > 65535) {
                errors.add("port must be between 1 and 65535");
            }
        }
        if (username == null || username.isBlank()) {
            errors.add("username is required");
        }
        if (database == null || database.isBlank()) {
            errors.add("database name is required");
        }
        if (!errors.isEmpty()) {
            throw SchemaSyncException.validation("database configuration validation failed: " + errors);
        }
    }

    /** Never null; falls back to {@link #DEFAULT_TIMEOUT}. */
    public Duration effectiveTimeout() {
        return timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    public String describe() {
        return database + "@" + (url != null && !url.isBlank() ? url : host + ":" + port);
    }
}
