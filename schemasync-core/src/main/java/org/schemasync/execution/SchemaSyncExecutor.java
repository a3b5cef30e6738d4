package org.schemasync.execution;

import lombok.extern.slf4j.Slf4j;
import org.schemasync.database.DatabaseConfig;
import org.schemasync.database.DatabaseService;
import org.schemasync.database.SchemaExtractor;
import org.schemasync.error.ErrorClassifier;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.MigrationPlan;
import org.schemasync.migration.MigrationPlanner;
import org.schemasync.migration.MigrationStatement;
import org.schemasync.migration.differs.SchemaDiffer;
import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs one synchronization: connect, extract, compare, plan, validate, then report (dry run) or execute.
 * Never throws for pipeline failures; they end up in {@link ExecutionResult#getError()}.
 */
@Slf4j
public class SchemaSyncExecutor {

    private final ExecutionConfig config;
    private final DatabaseService databaseService;
    private final SchemaExtractor schemaExtractor;
    private final SchemaDiffer schemaDiffer;
    private final MigrationPlanner migrationPlanner;
    private final ProgressReporter progress;
    private final RetryHandler retryHandler;

    public SchemaSyncExecutor(ExecutionConfig config, DatabaseService databaseService, SchemaExtractor schemaExtractor) {
        this(config, databaseService, schemaExtractor, ProgressReporter.NONE);
    }

    public SchemaSyncExecutor(ExecutionConfig config, DatabaseService databaseService,
                              SchemaExtractor schemaExtractor, ProgressReporter progress) {
        this(config, databaseService, schemaExtractor, new SchemaDiffer(), new MigrationPlanner(), progress);
    }

    public SchemaSyncExecutor(ExecutionConfig config, DatabaseService databaseService, SchemaExtractor schemaExtractor,
                              SchemaDiffer schemaDiffer, MigrationPlanner migrationPlanner, ProgressReporter progress) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.databaseService = Objects.requireNonNull(databaseService, "databaseService must not be null");
        this.schemaExtractor = Objects.requireNonNull(schemaExtractor, "schemaExtractor must not be null");
        this.schemaDiffer = Objects.requireNonNull(schemaDiffer, "schemaDiffer must not be null");
        this.migrationPlanner = Objects.requireNonNull(migrationPlanner, "migrationPlanner must not be null");
        this.progress = progress == null ? ProgressReporter.NONE : progress;
        this.retryHandler = new RetryHandler(config.getRetry() == null ? RetryConfig.defaults() : config.getRetry());
    }

    /**
     * Runs with a fresh context bounded by {@link ExecutionConfig#getTimeout()}.
     */
    public ExecutionResult execute() {
        Duration timeout = config.getTimeout() == null ? Duration.ZERO : config.getTimeout();
        return execute(SyncContext.withTimeout(timeout));
    }

    public ExecutionResult execute(SyncContext context) {
        Objects.requireNonNull(context, "context must not be null");
        long started = System.nanoTime();
        ExecutionResult result = new ExecutionResult();
        result.setDryRun(config.isDryRun());

        RoleConnection source = new RoleConnection("source", config.getSource());
        RoleConnection target = new RoleConnection("target", config.getTarget());
        try {
            config.validate();

            progress.phase("Connecting to databases");
            source.open(context);
            target.open(context);

            progress.phase("Extracting schemas");
            Schema sourceSchema = extract(context, source);
            Schema targetSchema = extract(context, target);

            progress.phase("Comparing schemas");
            context.checkActive();
            SchemaDiff diff = schemaDiffer.compare(sourceSchema, targetSchema);
            result.setSchemaDiff(diff);
            result.addWarnings(diff.getWarnings());

            if (diff.isEmpty()) {
                log.info("Schemas are already synchronized");
                result.setSuccess(true);
                return result;
            }

            progress.phase("Planning migration");
            MigrationPlan plan = migrationPlanner.plan(diff);
            result.setMigrationPlan(plan);
            result.addWarnings(plan.getWarnings());

            progress.phase("Validating migration plan");
            migrationPlanner.validate(plan);
            log.info("Migration plan ready: {} statement(s), {} destructive",
                    plan.getStatements().size(), plan.getSummary().getDestructiveCount());

            if (config.isDryRun()) {
                log.info("Dry run: {} statement(s) planned, target database left untouched", plan.getStatements().size());
                result.setSuccess(true);
                return result;
            }

            progress.phase("Executing migration");
            executeStatements(context, target, plan, result);

            log.info("Schema synchronization completed: {} statement(s) executed", result.getExecutedStatements().size());
            result.setSuccess(true);
        } catch (Exception e) {
            SchemaSyncException error = ErrorClassifier.classify(e);
            if (error.isRecoverable()) {
                log.warn("Schema synchronization failed with recoverable error: {}", error.getMessage(), error);
            } else {
                log.error("Schema synchronization failed: {}", error.getMessage(), error);
            }
            result.setSuccess(false);
            result.setError(error);
        } finally {
            target.close();
            source.close();
            result.setDuration(Duration.ofNanos(System.nanoTime() - started));
        }
        return result;
    }

    private Schema extract(SyncContext context, RoleConnection connection) {
        String role = connection.role;
        String database = connection.databaseConfig.getDatabase();
        log.info("Extracting {} schema {}", role, database);
        Schema schema;
        try {
            schema = retryHandler.execute(context, "extract " + role + " schema",
                    () -> connection.call(c -> schemaExtractor.extractSchema(c, database)));
        } catch (SchemaSyncException e) {
            throw e.withContext("role", role);
        }
        if (schema == null) {
            throw new SchemaSyncException(ErrorType.SCHEMA,
                    role + " schema extraction returned no schema").withContext("role", role);
        }
        log.debug("Extracted {} table(s) from {} schema", schema.getTables().size(), role);
        return schema;
    }

    private void executeStatements(SyncContext context, RoleConnection target, MigrationPlan plan,
                                   ExecutionResult result) {
        List<MigrationStatement> statements = plan.getStatements();
        int total = statements.size();
        for (int i = 0; i < total; i++) {
            MigrationStatement statement = statements.get(i);
            int index = i + 1;
            progress.statement(index, total, statement);
            log.info("Executing statement {}/{}: {}", index, total, statement.getDescription());
            try {
                retryHandler.run(context, "execute migration statement " + index,
                        () -> target.call(c -> {
                            databaseService.executeSql(c, List.of(statement.getSql()), statementTimeout(context));
                            return null;
                        }));
            } catch (SchemaSyncException e) {
                throw SchemaSyncException.wrap(e, String.format("failed to execute migration statement %d", index))
                        .withContext("statement_index", index)
                        .withContext("statement", statement.getSql());
            }
            result.addExecutedStatement(statement);
        }
    }

    /**
     * Time left on the context for one statement; zero when the context has no deadline.
     */
    static Duration statementTimeout(SyncContext context) {
        return context.remaining()
                .map(left -> left.isZero() ? Duration.ofMillis(1) : left)
                .orElse(Duration.ZERO);
    }

    @FunctionalInterface
    private interface ConnectionCall<T> {
        T apply(Connection connection) throws Exception;
    }

    /**
     * Connection of one side of the run. A connection-level failure marks it broken, and the next call opens a
     * fresh one before touching the server again.
     */
    private final class RoleConnection {

        private final String role;
        private final DatabaseConfig databaseConfig;
        private Connection connection;
        private boolean broken;

        RoleConnection(String role, DatabaseConfig databaseConfig) {
            this.role = role;
            this.databaseConfig = databaseConfig;
        }

        void open(SyncContext context) {
            log.info("Connecting to {} database {}", role, databaseConfig.describe());
            try {
                connection = retryHandler.execute(context, "connect to " + role + " database",
                        () -> databaseService.connect(databaseConfig));
            } catch (SchemaSyncException e) {
                throw e.withContext("role", role);
            }
        }

        <T> T call(ConnectionCall<T> call) throws Exception {
            if (broken) {
                reconnect();
            }
            try {
                return call.apply(connection);
            } catch (Exception e) {
                SchemaSyncException classified = ErrorClassifier.classify(e);
                if (classified.getType() == ErrorType.CONNECTION) {
                    log.warn("Lost {} database connection: {}", role, classified.getMessage());
                    broken = true;
                }
                throw e;
            }
        }

        private void reconnect() throws SQLException {
            close();
            log.info("Reconnecting to {} database {}", role, databaseConfig.describe());
            connection = databaseService.connect(databaseConfig);
            broken = false;
        }

        void close() {
            if (connection == null) {
                return;
            }
            try {
                databaseService.close(connection);
            } catch (SQLException | RuntimeException e) {
                log.warn("Failed to close {} database connection: {}", role, e.getMessage());
            } finally {
                connection = null;
            }
        }
    }
}
