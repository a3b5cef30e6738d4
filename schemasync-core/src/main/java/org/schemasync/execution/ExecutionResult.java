package org.schemasync.execution;

import lombok.Getter;
import lombok.Setter;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.MigrationPlan;
import org.schemasync.migration.MigrationStatement;
import org.schemasync.model.SchemaDiff;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one synchronization run. Diff, plan and executed statements are kept even when the run fails.
 */
@Getter
@Setter
public class ExecutionResult {

    private boolean success;
    private boolean dryRun;
    private SchemaDiff schemaDiff;
    private MigrationPlan migrationPlan;
    private Duration duration = Duration.ZERO;
    private SchemaSyncException error;

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final List<MigrationStatement> executedStatements = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final List<String> warnings = new ArrayList<>();

    public List<MigrationStatement> getExecutedStatements() {
        return Collections.unmodifiableList(executedStatements);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void addExecutedStatement(MigrationStatement statement) {
        executedStatements.add(statement);
    }

    void addWarnings(List<String> more) {
        for (String warning : more) {
            if (!warnings.contains(warning)) {
                warnings.add(warning);
            }
        }
    }

    /** True when nothing needed to change. */
    public boolean isAlreadyInSync() {
        return success && schemaDiff != null && schemaDiff.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ExecutionResult{success=").append(success)
                .append(", dryRun=").append(dryRun)
                .append(", executed=").append(executedStatements.size());
        if (migrationPlan != null) {
            sb.append("/").append(migrationPlan.getStatements().size());
        }
        sb.append(", warnings=").append(warnings.size())
                .append(", duration=").append(duration.toMillis()).append("ms");
        if (error != null) {
            sb.append(", error=").append(error.getType()).append(": ").append(error.getMessage());
        }
        return sb.append('}').toString();
    }
}
