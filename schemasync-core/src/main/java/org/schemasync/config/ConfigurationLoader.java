package org.schemasync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.schemasync.config.SchemaSyncConfiguration.DatabaseConfiguration;
import org.schemasync.config.SchemaSyncConfiguration.ProfileConfiguration;
import org.schemasync.execution.RetryConfig;
import org.schemasync.options.SchemaSyncOptions;
import org.schemasync.options.SchemaSyncOptions.Database;
import org.schemasync.options.SchemaSyncOptions.Execution;
import org.schemasync.options.SchemaSyncOptions.Retry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Finds {@code schemasync.yaml} and flattens the active profile into option keys.
 */
@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = SchemaSyncOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SchemaSyncOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SchemaSyncOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads the configuration and applies the active profile.
     * Priority: CLI profile, then {@code SCHEMASYNC_PROFILE}, then {@code dev}.
     *
     * @param cliProfile profile given on the command line, may be null
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SchemaSyncConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root.
     */
    private Optional<SchemaSyncConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    log.debug("Loading configuration from {}", configFile);
                    return Optional.ofNullable(yamlMapper.readValue(configFile.toFile(), SchemaSyncConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SchemaSyncConfiguration config, String profile) {
        ProfileConfiguration profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        Map<String, String> configMap = new HashMap<>(createDefaultConfiguration());

        putDatabase(configMap, Database.SOURCE_PREFIX, profileConfig.getSource());
        putDatabase(configMap, Database.TARGET_PREFIX, profileConfig.getTarget());

        var execution = profileConfig.getExecution();
        if (execution != null) {
            put(configMap, Execution.DRY_RUN_KEY, execution.getDryRun());
            put(configMap, Execution.TIMEOUT_SECONDS_KEY, execution.getTimeout());
        }

        var retry = profileConfig.getRetry();
        if (retry != null) {
            put(configMap, Retry.MAX_ATTEMPTS_KEY, retry.getMaxAttempts());
            put(configMap, Retry.BASE_DELAY_MILLIS_KEY, retry.getBaseDelayMillis());
            put(configMap, Retry.MAX_DELAY_MILLIS_KEY, retry.getMaxDelayMillis());
            put(configMap, Retry.MULTIPLIER_KEY, retry.getMultiplier());
        }

        return configMap;
    }

    private void putDatabase(Map<String, String> configMap, String prefix, DatabaseConfiguration database) {
        if (database == null) {
            return;
        }
        put(configMap, prefix + Database.HOST, database.getHost());
        put(configMap, prefix + Database.PORT, database.getPort());
        put(configMap, prefix + Database.USERNAME, database.getUsername());
        put(configMap, prefix + Database.PASSWORD, database.getPassword());
        put(configMap, prefix + Database.NAME, database.getDatabase());
        put(configMap, prefix + Database.URL, database.getUrl());
        put(configMap, prefix + Database.TIMEOUT_SECONDS, database.getTimeout());
    }

    private static void put(Map<String, String> configMap, String key, Object value) {
        if (value != null) {
            configMap.put(key, String.valueOf(value));
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        RetryConfig retry = RetryConfig.defaults();
        Map<String, String> defaults = new HashMap<>();
        defaults.put(Database.source(Database.PORT), String.valueOf(Database.PORT_DEFAULT));
        defaults.put(Database.target(Database.PORT), String.valueOf(Database.PORT_DEFAULT));
        defaults.put(Database.source(Database.TIMEOUT_SECONDS), String.valueOf(Database.TIMEOUT_SECONDS_DEFAULT));
        defaults.put(Database.target(Database.TIMEOUT_SECONDS), String.valueOf(Database.TIMEOUT_SECONDS_DEFAULT));
        defaults.put(Execution.DRY_RUN_KEY, String.valueOf(Execution.DRY_RUN_DEFAULT));
        defaults.put(Execution.TIMEOUT_SECONDS_KEY, String.valueOf(Execution.TIMEOUT_SECONDS_DEFAULT));
        defaults.put(Retry.MAX_ATTEMPTS_KEY, String.valueOf(retry.getMaxAttempts()));
        defaults.put(Retry.BASE_DELAY_MILLIS_KEY, String.valueOf(retry.getBaseDelay().toMillis()));
        defaults.put(Retry.MAX_DELAY_MILLIS_KEY, String.valueOf(retry.getMaxDelay().toMillis()));
        defaults.put(Retry.MULTIPLIER_KEY, String.valueOf(retry.getMultiplier()));
        return defaults;
    }
}
