package org.schemasync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Object form of {@code schemasync.yaml}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaSyncConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("source")
        private DatabaseConfiguration source;

        @JsonProperty("target")
        private DatabaseConfiguration target;

        @JsonProperty("execution")
        private ExecutionConfiguration execution;

        @JsonProperty("retry")
        private RetryConfiguration retry;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatabaseConfiguration {

        @JsonProperty("host")
        private String host;

        @JsonProperty("port")
        private Integer port;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;

        @JsonProperty("database")
        private String database;

        @JsonProperty("url")
        private String url;

        /** Connect timeout in seconds. */
        @JsonProperty("timeout")
        private Integer timeout;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExecutionConfiguration {

        @JsonProperty("dryRun")
        private Boolean dryRun;

        /** Whole-run deadline in seconds. */
        @JsonProperty("timeout")
        private Integer timeout;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfiguration {

        @JsonProperty("maxAttempts")
        private Integer maxAttempts;

        @JsonProperty("baseDelayMillis")
        private Long baseDelayMillis;

        @JsonProperty("maxDelayMillis")
        private Long maxDelayMillis;

        @JsonProperty("multiplier")
        private Double multiplier;
    }
}
