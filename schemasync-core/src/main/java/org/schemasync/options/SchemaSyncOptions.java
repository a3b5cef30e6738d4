package org.schemasync.options;

/**
 * Configuration keys shared by the YAML loader, the CLI and {@code ExecutionConfig}.
 */
public final class SchemaSyncOptions {

    private SchemaSyncOptions() {
    }

    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "SCHEMASYNC_PROFILE";

        public static final String CONFIG_FILE = "schemasync.yaml";
    }

    /**
     * Per-role database keys. Build them with {@link #source(String)} or {@link #target(String)}.
     */
    public static final class Database {
        private Database() {}

        public static final String SOURCE_PREFIX = "schemasync.source.";
        public static final String TARGET_PREFIX = "schemasync.target.";

        public static final String HOST = "host";
        public static final String PORT = "port";
        public static final String USERNAME = "username";
        public static final String PASSWORD = "password";
        public static final String NAME = "database";
        public static final String URL = "url";
        public static final String TIMEOUT_SECONDS = "timeoutSeconds";

        public static final int PORT_DEFAULT = 3306;
        public static final int TIMEOUT_SECONDS_DEFAULT = 30;

        public static String source(String key) {
            return SOURCE_PREFIX + key;
        }

        public static String target(String key) {
            return TARGET_PREFIX + key;
        }
    }

    public static final class Execution {
        private Execution() {}

        public static final String DRY_RUN_KEY = "schemasync.execution.dryRun";
        public static final boolean DRY_RUN_DEFAULT = false;

        /**
         * Whole-run deadline in seconds; 0 means none.
         */
        public static final String TIMEOUT_SECONDS_KEY = "schemasync.execution.timeoutSeconds";
        public static final int TIMEOUT_SECONDS_DEFAULT = 0;
    }

    public static final class Retry {
        private Retry() {}

        public static final String MAX_ATTEMPTS_KEY = "schemasync.retry.maxAttempts";
        public static final String BASE_DELAY_MILLIS_KEY = "schemasync.retry.baseDelayMillis";
        public static final String MAX_DELAY_MILLIS_KEY = "schemasync.retry.maxDelayMillis";
        public static final String MULTIPLIER_KEY = "schemasync.retry.multiplier";
    }
}
