package org.schemasync.migration;

import lombok.extern.slf4j.Slf4j;
import org.schemasync.migration.dialect.mysql.MySqlDialect;
import org.schemasync.migration.dialect.mysql.MySqlUtil;
import org.schemasync.migration.spi.dialect.DdlDialect;
import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.Constraint;
import org.schemasync.model.ConstraintType;
import org.schemasync.model.Index;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a {@link SchemaDiff} into an ordered {@link MigrationPlan}. Statements are sorted by
 * {@link StatementType#executionOrder()} so drops run before creates and constraints are added last.
 */
@Slf4j
public class MigrationPlanner {

    static final String DESTRUCTIVE_WARNING = "This migration contains destructive operations that may result in data loss";
    static final String BACKUP_WARNING = "Please ensure you have a backup before proceeding";

    private final DdlDialect dialect;
    private final ChangeValidator changeValidator;

    public MigrationPlanner() {
        this(new MySqlDialect());
    }

    public MigrationPlanner(DdlDialect dialect) {
        this(dialect, new ChangeValidator());
    }

    public MigrationPlanner(DdlDialect dialect, ChangeValidator changeValidator) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.changeValidator = Objects.requireNonNull(changeValidator, "changeValidator must not be null");
    }

    public MigrationPlan plan(SchemaDiff diff) {
        Objects.requireNonNull(diff, "diff must not be null");
        MigrationPlan plan = new MigrationPlan();

        diff.getWarnings().forEach(plan::addWarning);
        changeValidator.findDependencyProblems(diff).forEach(plan::addWarning);

        for (Table table : diff.getRemovedTables()) {
            planRemovedTable(plan, table);
        }
        for (Constraint constraint : diff.getRemovedConstraints()) {
            dropConstraint(plan, constraint);
        }
        for (Index index : diff.getRemovedIndexes()) {
            dropIndex(plan, index);
        }
        for (TableDiff tableDiff : diff.getModifiedTables()) {
            planTableModification(plan, tableDiff);
        }
        for (Table table : diff.getAddedTables()) {
            planAddedTable(plan, table);
        }
        for (Index index : diff.getAddedIndexes()) {
            createIndex(plan, index);
        }
        for (Constraint constraint : diff.getAddedConstraints()) {
            addConstraint(plan, constraint);
        }

        plan.sortByExecutionOrder();

        if (plan.hasDestructiveOperations()) {
            plan.addWarning(DESTRUCTIVE_WARNING);
            plan.addWarning(BACKUP_WARNING);
        }
        log.debug("Planned {} statements ({} destructive)",
                plan.getSummary().getTotalStatements(), plan.getSummary().getDestructiveCount());
        return plan;
    }

    /**
     * Fails if the plan is empty or any statement is incomplete.
     */
    public void validate(MigrationPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        plan.validate();
    }

    // ------------------------------------------------------------------ tables

    private void planRemovedTable(MigrationPlan plan, Table table) {
        // its foreign keys go first so that drop order between removed tables does not matter
        table.getConstraints().values().stream()
                .filter(c -> c.getType() == ConstraintType.FOREIGN_KEY)
                .forEach(c -> dropConstraint(plan, withTable(c, table.getName())));

        add(plan, new SchemaChange.DropTable(table), "Drop table " + table.getName(), List.of());
        plan.addWarning(String.format("Dropping table '%s' will permanently delete all data in the table", table.getName()));
    }

    private void planAddedTable(MigrationPlan plan, Table table) {
        add(plan, new SchemaChange.CreateTable(table), "Create table " + table.getName(), List.of());

        for (Index index : table.getIndexes()) {
            // primary and unique keys are part of CREATE TABLE
            if (!index.isPrimary() && !index.isUnique()) {
                createIndex(plan, withTable(index, table.getName()));
            }
        }
        for (Constraint constraint : table.getConstraints().values()) {
            if (constraint.getType() == ConstraintType.UNIQUE && hasUniqueIndex(table, constraint.getName())) {
                continue;
            }
            addConstraint(plan, withTable(constraint, table.getName()));
        }
    }

    private void planTableModification(MigrationPlan plan, TableDiff tableDiff) {
        String table = tableDiff.getTableName();

        for (Constraint constraint : tableDiff.getRemovedConstraints()) {
            dropConstraint(plan, withTable(constraint, table));
        }
        for (Column column : tableDiff.getRemovedColumns()) {
            add(plan, new SchemaChange.DropColumn(table, column),
                    String.format("Drop column %s from table %s", column.getName(), table), List.of(table));
            plan.addWarning(String.format("Dropping column '%s.%s' will permanently delete all data in the column",
                    table, column.getName()));
        }
        for (Column column : tableDiff.getAddedColumns()) {
            add(plan, new SchemaChange.AddColumn(table, column),
                    String.format("Add column %s to table %s", column.getName(), table), List.of(table));
            if (!column.isNullable() && column.getDefaultValue() == null && !isAutoIncrement(column)) {
                plan.addWarning(String.format(
                        "Adding NOT NULL column '%s.%s' without default value may fail if table contains data",
                        table, column.getName()));
            }
        }
        for (ColumnDiff columnDiff : tableDiff.getModifiedColumns()) {
            add(plan, new SchemaChange.ModifyColumn(table, columnDiff),
                    String.format("Modify column %s in table %s", columnDiff.getColumnName(), table), List.of(table));
            addModificationWarnings(plan, table, columnDiff);
        }
        for (Constraint constraint : tableDiff.getAddedConstraints()) {
            addConstraint(plan, withTable(constraint, table));
        }
    }

    private void addModificationWarnings(MigrationPlan plan, String table, ColumnDiff diff) {
        Column oldColumn = diff.getOldColumn();
        Column newColumn = diff.getNewColumn();
        if (oldColumn == null || newColumn == null) {
            return;
        }
        String name = diff.getColumnName();

        if (!Objects.equals(oldColumn.getDataType(), newColumn.getDataType())) {
            plan.addWarning(String.format(
                    "Changing data type of column '%s.%s' from %s to %s may cause data loss or conversion errors",
                    table, name, oldColumn.getDataType(), newColumn.getDataType()));
            if (MySqlUtil.isNarrowing(oldColumn.getDataType(), newColumn.getDataType())) {
                plan.addWarning(String.format(
                        "Column '%s.%s' is narrowed from %s to %s; existing values may be truncated",
                        table, name, oldColumn.getDataType(), newColumn.getDataType()));
            }
        }
        if (oldColumn.isNullable() && !newColumn.isNullable()) {
            plan.addWarning(String.format(
                    "Changing column '%s.%s' from nullable to NOT NULL may fail if existing data contains NULL values",
                    table, name));
        }
        if (!Objects.equals(oldColumn.getDefaultValue(), newColumn.getDefaultValue())) {
            plan.addWarning(String.format("Default value change for column '%s.%s' will only affect new rows", table, name));
        }
    }

    // ------------------------------------------------------------------ indexes and constraints

    private void createIndex(MigrationPlan plan, Index index) {
        add(plan, new SchemaChange.CreateIndex(index),
                String.format("Create index %s on table %s", index.getName(), index.getTableName()),
                Arrays.asList(index.getTableName()));
        if (index.isPrimary()) {
            plan.addWarning(String.format("Primary key of table '%s' is being changed", index.getTableName()));
        }
    }

    private void dropIndex(MigrationPlan plan, Index index) {
        add(plan, new SchemaChange.DropIndex(index),
                String.format("Drop index %s on table %s", index.getName(), index.getTableName()), List.of());
        plan.addWarning(String.format("Dropping index '%s' on table '%s' may slow down queries that rely on it",
                index.getName(), index.getTableName()));
    }

    private void addConstraint(MigrationPlan plan, Constraint constraint) {
        List<String> dependencies = constraint.getType() == ConstraintType.FOREIGN_KEY && constraint.getReferencedTable() != null
                ? Arrays.asList(constraint.getTableName(), constraint.getReferencedTable())
                : Arrays.asList(constraint.getTableName());
        add(plan, new SchemaChange.AddConstraint(constraint),
                String.format("Add %s constraint %s to table %s",
                        label(constraint), constraint.getName(), constraint.getTableName()),
                dependencies);
    }

    private void dropConstraint(MigrationPlan plan, Constraint constraint) {
        add(plan, new SchemaChange.DropConstraint(constraint),
                String.format("Drop %s constraint %s on table %s",
                        label(constraint), constraint.getName(), constraint.getTableName()),
                List.of());
        plan.addWarning(String.format("Dropping %s constraint '%s' on table '%s' removes the rule it enforced",
                label(constraint), constraint.getName(), constraint.getTableName()));
    }

    private void add(MigrationPlan plan, SchemaChange change, String description, List<String> dependencies) {
        String sql = dialect.render(change);
        plan.addStatement(MigrationStatement.builder()
                .sql(sql)
                .type(change.type())
                .description(description)
                .tableName(change.tableName())
                .dependencies(dependencies.stream().filter(Objects::nonNull).distinct().toList())
                .build());
    }

    // ------------------------------------------------------------------ helpers

    private static String label(Constraint constraint) {
        return constraint.getType() == null ? "unknown" : constraint.getType().label();
    }

    private static boolean isAutoIncrement(Column column) {
        return column.getExtra() != null && column.getExtra().toUpperCase(Locale.ROOT).contains("AUTO_INCREMENT");
    }

    private static boolean hasUniqueIndex(Table table, String name) {
        return table.getIndexes().stream().anyMatch(i -> i.isUnique() && !i.isPrimary() && Objects.equals(i.getName(), name));
    }

    private static Index withTable(Index index, String tableName) {
        if (index.getTableName() != null && !index.getTableName().isBlank()) {
            return index;
        }
        return index.toBuilder().tableName(tableName).build();
    }

    private static Constraint withTable(Constraint constraint, String tableName) {
        if (constraint.getTableName() != null && !constraint.getTableName().isBlank()) {
            return constraint;
        }
        return constraint.toBuilder().tableName(tableName).build();
    }
}
