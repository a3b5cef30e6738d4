package org.schemasync.cli;

import org.schemasync.config.ConfigurationLoader;
import org.schemasync.database.JdbcDatabaseService;
import org.schemasync.database.SchemaExtractor;
import org.schemasync.error.ErrorClassifier;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.execution.ExecutionConfig;
import org.schemasync.execution.ExecutionResult;
import org.schemasync.execution.SchemaSyncExecutor;
import org.schemasync.execution.SyncContext;
import org.schemasync.migration.MigrationPlan;
import org.schemasync.options.SchemaSyncOptions.Database;
import org.schemasync.options.SchemaSyncOptions.Execution;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Live synchronization between two MySQL databases.
 */
@Slf4j
@CommandLine.Command(
        name = "sync",
        mixinStandardHelpOptions = true,
        description = "Synchronizes the target database schema with the source database schema."
)
public class SyncCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;
    @CommandLine.Option(names = "--config-dir", description = "Directory to start searching for schemasync.yaml from")
    private Path configDir;
    @CommandLine.Option(names = "--dry-run", description = "Plan only; do not change the target database")
    private Boolean dryRun;
    @CommandLine.Option(names = "--timeout", description = "Deadline for the whole run in seconds (0 = none)")
    private Integer timeoutSeconds;

    @CommandLine.Option(names = "--source-host") private String sourceHost;
    @CommandLine.Option(names = "--source-port") private Integer sourcePort;
    @CommandLine.Option(names = "--source-user") private String sourceUser;
    @CommandLine.Option(names = "--source-password", interactive = true, arity = "0..1") private String sourcePassword;
    @CommandLine.Option(names = "--source-db") private String sourceDatabase;

    @CommandLine.Option(names = "--target-host") private String targetHost;
    @CommandLine.Option(names = "--target-port") private Integer targetPort;
    @CommandLine.Option(names = "--target-user") private String targetUser;
    @CommandLine.Option(names = "--target-password", interactive = true, arity = "0..1") private String targetPassword;
    @CommandLine.Option(names = "--target-db") private String targetDatabase;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ExecutionConfig config = ExecutionConfig.fromOptions(resolveOptions());
            SchemaExtractor extractor = findExtractor();

            SyncContext context = SyncContext.withTimeout(config.getTimeout());
            Thread hook = new Thread(context::cancel, "schemasync-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            ExecutionResult result;
            try {
                result = new SchemaSyncExecutor(config,
                        new JdbcDatabaseService(),
                        extractor,
                        new ConsoleProgressReporter(out))
                        .execute(context);
            } finally {
                removeHook(hook);
            }

            return report(result, out, err);
        } catch (Exception e) {
            printError(err, ErrorClassifier.classify(e));
            return 1;
        }
    }

    /**
     * Configuration file values overlaid with command line options.
     */
    Map<String, String> resolveOptions() {
        ConfigurationLoader loader = configDir == null
                ? new ConfigurationLoader()
                : new ConfigurationLoader(configDir.toAbsolutePath());
        Map<String, String> options = new HashMap<>(loader.loadConfiguration(profile));

        override(options, Execution.DRY_RUN_KEY, dryRun);
        override(options, Execution.TIMEOUT_SECONDS_KEY, timeoutSeconds);

        override(options, Database.source(Database.HOST), sourceHost);
        override(options, Database.source(Database.PORT), sourcePort);
        override(options, Database.source(Database.USERNAME), sourceUser);
        override(options, Database.source(Database.PASSWORD), sourcePassword);
        override(options, Database.source(Database.NAME), sourceDatabase);

        override(options, Database.target(Database.HOST), targetHost);
        override(options, Database.target(Database.PORT), targetPort);
        override(options, Database.target(Database.USERNAME), targetUser);
        override(options, Database.target(Database.PASSWORD), targetPassword);
        override(options, Database.target(Database.NAME), targetDatabase);
        return options;
    }

    private static void override(Map<String, String> options, String key, Object value) {
        if (value != null) {
            options.put(key, String.valueOf(value));
        }
    }

    static SchemaExtractor findExtractor() {
        Iterator<SchemaExtractor> extractors = ServiceLoader.load(SchemaExtractor.class).iterator();
        if (!extractors.hasNext()) {
            throw SchemaSyncException.validation("No SchemaExtractor implementation found on the classpath")
                    .withUserMessage("No schema extractor available. Add a SchemaExtractor implementation to the classpath.");
        }
        return extractors.next();
    }

    private int report(ExecutionResult result, PrintWriter out, PrintWriter err) {
        result.getWarnings().forEach(w -> out.println("Warning: " + w));

        if (!result.isSuccess()) {
            printError(err, result.getError());
            if (!result.getExecutedStatements().isEmpty()) {
                err.println("   Statements executed before the failure: " + result.getExecutedStatements().size());
            }
            return 1;
        }

        if (result.isAlreadyInSync()) {
            out.println("Schemas are already in sync.");
            return 0;
        }

        MigrationPlan plan = result.getMigrationPlan();
        if (result.isDryRun()) {
            out.println(plan);
            out.println();
            plan.getStatements().forEach(s -> out.println(s.getSql() + ";"));
            out.println("Dry run complete. No changes were made.");
        } else {
            out.printf("Schema synchronization complete: %d statement(s) executed in %dms.%n",
                    result.getExecutedStatements().size(), result.getDuration().toMillis());
        }
        return 0;
    }

    private void printError(PrintWriter err, SchemaSyncException error) {
        err.println("Sync failed: " + error.getUserMessage());
        error.getContext().forEach((k, v) -> err.println("   " + k + ": " + v));
        var hints = error.getType().troubleshooting();
        if (!hints.isEmpty()) {
            err.println("Troubleshooting:");
            hints.forEach(h -> err.println("   - " + h));
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, hook not removed: {}", e.getMessage());
        }
    }
}
