package org.schemasync.migration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered statements plus warnings. The summary is recomputed on every mutation and cannot be set directly.
 */
@JsonIgnoreProperties(value = {"summary"}, allowGetters = true)
public class MigrationPlan {

    static final Comparator<MigrationStatement> EXECUTION_ORDER =
            Comparator.comparingInt((MigrationStatement s) -> s.getType().executionOrder())
                    .thenComparing(s -> s.getTableName() == null ? "" : s.getTableName());

    private final List<MigrationStatement> statements = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private MigrationSummary summary = MigrationSummary.empty();

    public MigrationPlan() {
    }

    /**
     * Restores a plan as-is, e.g. from a persisted JSON document. Statements are not validated here;
     * call {@link #validate()}.
     */
    @JsonCreator
    public MigrationPlan(@JsonProperty("statements") List<MigrationStatement> statements,
                         @JsonProperty("warnings") List<String> warnings) {
        if (statements != null) {
            this.statements.addAll(statements);
        }
        if (warnings != null) {
            this.warnings.addAll(warnings);
        }
        refreshSummary();
    }

    /**
     * @throws SchemaSyncException VALIDATION if the statement is incomplete
     */
    public void addStatement(MigrationStatement statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        statement.validate();
        statements.add(statement);
        refreshSummary();
    }

    public void addWarning(String warning) {
        if (warning != null && !warning.isBlank()) {
            warnings.add(warning);
        }
    }

    /**
     * Stable sort by execution order, ties broken by table name.
     */
    void sortByExecutionOrder() {
        statements.sort(EXECUTION_ORDER);
        refreshSummary();
    }

    @JsonProperty("statements")
    public List<MigrationStatement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @JsonProperty("summary")
    public MigrationSummary getSummary() {
        return summary;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public boolean hasDestructiveOperations() {
        return summary.getDestructiveCount() > 0;
    }

    public List<MigrationStatement> getStatementsByType(StatementType type) {
        return statements.stream().filter(s -> s.getType() == type).toList();
    }

    public List<MigrationStatement> getStatementsByTable(String tableName) {
        return statements.stream().filter(s -> Objects.equals(s.getTableName(), tableName)).toList();
    }

    /**
     * @throws SchemaSyncException VALIDATION if the plan is empty or any statement is incomplete
     */
    public void validate() {
        if (statements.isEmpty()) {
            throw SchemaSyncException.validation("migration plan must have at least one statement");
        }
        for (int i = 0; i < statements.size(); i++) {
            MigrationStatement stmt = statements.get(i);
            if (stmt == null) {
                throw SchemaSyncException.validation("invalid statement at index " + i + ": statement is null");
            }
            try {
                stmt.validate();
            } catch (SchemaSyncException e) {
                throw new SchemaSyncException(ErrorType.VALIDATION,
                        "invalid statement at index " + i + ": " + e.getMessage(), e)
                        .withContext("statement_index", i);
            }
        }
    }

    private void refreshSummary() {
        summary = MigrationSummary.of(statements);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Migration Plan Summary:\n");
        sb.append("  Total Statements: ").append(summary.getTotalStatements()).append('\n');
        sb.append("  Destructive Operations: ").append(summary.getDestructiveCount()).append('\n');
        sb.append(String.format("  Tables: +%d -%d ~%d\n",
                summary.getTablesAdded(), summary.getTablesRemoved(), summary.getTablesModified()));
        sb.append(String.format("  Columns: +%d -%d ~%d\n",
                summary.getColumnsAdded(), summary.getColumnsRemoved(), summary.getColumnsModified()));
        sb.append(String.format("  Indexes: +%d -%d\n", summary.getIndexesAdded(), summary.getIndexesRemoved()));
        sb.append(String.format("  Constraints: +%d -%d\n",
                summary.getConstraintsAdded(), summary.getConstraintsRemoved()));

        if (!warnings.isEmpty()) {
            sb.append("\nWarnings:\n");
            warnings.forEach(w -> sb.append("  - ").append(w).append('\n'));
        }
        return sb.toString();
    }
}
