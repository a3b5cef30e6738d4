package org.schemasync.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.differs.SchemaDiffer;
import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.schemasync.testing.SchemaFixtures.*;

class MigrationPlannerTest {

    private MigrationPlanner planner;
    private SchemaDiffer differ;

    @BeforeEach
    void setUp() {
        planner = new MigrationPlanner();
        differ = new SchemaDiffer();
    }

    @Test
    @DisplayName("Statements follow the execution order of their types")
    void orderingInvariant() {
        // given: source drops `legacy`, adds `orders`, alters users
        Table sourceUsers = users();
        sourceUsers.getColumns().remove("email");
        sourceUsers.addColumn(column("name", "VARCHAR(50)", true, 3));
        Table legacy = Table.builder().name("legacy").build().addColumn(idColumn());

        Schema source = Schema.of("src", sourceUsers, orders());
        Schema target = Schema.of("tgt", users(), legacy);

        // when
        MigrationPlan plan = planner.plan(differ.compare(source, target));

        // then
        List<MigrationStatement> statements = plan.getStatements();
        for (int i = 1; i < statements.size(); i++) {
            assertTrue(statements.get(i - 1).getType().executionOrder() <= statements.get(i).getType().executionOrder(),
                    "out of order at " + i + ": " + statements);
        }
        assertEquals(List.of(
                StatementType.DROP_COLUMN,
                StatementType.DROP_TABLE,
                StatementType.CREATE_TABLE,
                StatementType.ADD_COLUMN,
                StatementType.CREATE_INDEX,
                StatementType.ADD_CONSTRAINT
        ), statements.stream().map(MigrationStatement::getType).toList());
    }

    @Test
    @DisplayName("All nine statement types run in execution order, ties broken by table name")
    void fullExecutionOrder() {
        // given: every change kind on two tables, listed zeta first
        SchemaDiff diff = SchemaDiff.builder()
                .addedConstraints(List.of(check("ck_zeta", "zeta", "qty > 0"), check("ck_alpha", "alpha", "qty > 0")))
                .addedIndexes(List.of(index("idx_zeta_qty", "zeta", "qty"), index("idx_alpha_qty", "alpha", "qty")))
                .addedTables(List.of(table("zeta_log"), table("alpha_log")))
                .removedTables(List.of(table("legacy")))
                .removedIndexes(List.of(index("idx_zeta_old", "zeta", "qty"), index("idx_alpha_old", "alpha", "qty")))
                .removedConstraints(List.of(foreignKey("fk_zeta_old", "zeta", "owner_id", "users", "id")))
                .modifiedTables(List.of(modification("zeta"), modification("alpha")))
                .build();

        // when
        MigrationPlan plan = planner.plan(diff);

        // then
        List<String> order = plan.getStatements().stream()
                .map(s -> s.getType().executionOrder() + " " + s.getType() + " " + s.getTableName())
                .toList();
        assertEquals(List.of(
                "1 DROP_CONSTRAINT alpha",
                "1 DROP_CONSTRAINT zeta",
                "2 DROP_INDEX alpha",
                "2 DROP_INDEX zeta",
                "3 DROP_COLUMN alpha",
                "3 DROP_COLUMN zeta",
                "4 DROP_TABLE legacy",
                "5 CREATE_TABLE alpha_log",
                "5 CREATE_TABLE zeta_log",
                "6 ADD_COLUMN alpha",
                "6 ADD_COLUMN zeta",
                "7 MODIFY_COLUMN alpha",
                "7 MODIFY_COLUMN zeta",
                "8 CREATE_INDEX alpha",
                "8 CREATE_INDEX zeta",
                "9 ADD_CONSTRAINT alpha",
                "9 ADD_CONSTRAINT zeta"
        ), order);
        assertEquals(StatementType.values().length,
                plan.getStatements().stream().map(MigrationStatement::getType).distinct().count());
    }

    private static Table table(String name) {
        return Table.builder().name(name).build().addColumn(idColumn());
    }

    private static TableDiff modification(String table) {
        TableDiff tableDiff = TableDiff.builder().tableName(table).build();
        tableDiff.getRemovedColumns().add(column("legacy_flag", "TINYINT(1)", true, 4));
        tableDiff.getAddedColumns().add(column("qty", "INT", true, 3));
        tableDiff.getModifiedColumns().add(ColumnDiff.builder()
                .columnName("note")
                .oldColumn(column("note", "VARCHAR(50)", true, 2))
                .newColumn(column("note", "VARCHAR(100)", true, 2))
                .build());
        if (table.equals("alpha")) {
            tableDiff.getRemovedConstraints().add(foreignKey("fk_alpha_old", "alpha", "owner_id", "users", "id"));
        }
        return tableDiff;
    }

    @Test
    @DisplayName("Destructive statements are flagged and produce warnings")
    void destructiveDetection() {
        Table legacy = Table.builder().name("legacy").build().addColumn(idColumn());
        SchemaDiff diff = SchemaDiff.builder().removedTables(List.of(legacy)).build();

        MigrationPlan plan = planner.plan(diff);

        assertTrue(plan.hasDestructiveOperations());
        assertTrue(plan.getStatements().stream().allMatch(MigrationStatement::isDestructive));
        assertTrue(plan.getWarnings().contains(MigrationPlanner.DESTRUCTIVE_WARNING));
        assertTrue(plan.getWarnings().contains(MigrationPlanner.BACKUP_WARNING));
        assertTrue(plan.getWarnings().stream().anyMatch(w -> w.contains("Dropping table 'legacy'")));
    }

    @Test
    @DisplayName("A plan without destructive statements has no data-loss warning")
    void nonDestructive() {
        SchemaDiff diff = SchemaDiff.builder().addedTables(List.of(users())).build();

        MigrationPlan plan = planner.plan(diff);

        assertFalse(plan.hasDestructiveOperations());
        assertFalse(plan.getWarnings().contains(MigrationPlanner.DESTRUCTIVE_WARNING));
        assertEquals("Create table users", plan.getStatements().get(0).getDescription());
    }

    @Test
    @DisplayName("New tables get their secondary indexes and foreign keys after CREATE TABLE")
    void newTableObjects() {
        SchemaDiff diff = SchemaDiff.builder().addedTables(List.of(orders())).build();

        MigrationPlan plan = planner.plan(diff);

        assertEquals(3, plan.getStatements().size());
        assertEquals("CREATE INDEX `idx_orders_user` ON `orders` (`user_id`)",
                plan.getStatementsByType(StatementType.CREATE_INDEX).get(0).getSql());
        MigrationStatement fk = plan.getStatementsByType(StatementType.ADD_CONSTRAINT).get(0);
        assertTrue(fk.getSql().startsWith("ALTER TABLE `orders` ADD CONSTRAINT `fk_orders_user` FOREIGN KEY"));
        assertEquals(List.of("orders", "users"), fk.getDependencies());
    }

    @Test
    @DisplayName("Foreign keys of a dropped table are dropped before the table")
    void dropTableForeignKeysFirst() {
        SchemaDiff diff = SchemaDiff.builder().removedTables(List.of(orders())).build();

        MigrationPlan plan = planner.plan(diff);

        assertEquals(StatementType.DROP_CONSTRAINT, plan.getStatements().get(0).getType());
        assertEquals("ALTER TABLE `orders` DROP FOREIGN KEY `fk_orders_user`", plan.getStatements().get(0).getSql());
        assertEquals("DROP TABLE `orders`", plan.getStatements().get(1).getSql());
    }

    @Test
    @DisplayName("Column modification warnings: type change, narrowing, NOT NULL and default")
    void modificationWarnings() {
        ColumnDiff columnDiff = ColumnDiff.builder()
                .columnName("name")
                .oldColumn(column("name", "VARCHAR(255)", true, 1))
                .newColumn(Column.builder().name("name").dataType("VARCHAR(100)").nullable(false)
                        .defaultValue("''").build())
                .build();
        TableDiff tableDiff = TableDiff.builder().tableName("users").modifiedColumns(List.of(columnDiff)).build();

        MigrationPlan plan = planner.plan(SchemaDiff.builder().modifiedTables(List.of(tableDiff)).build());

        assertEquals("ALTER TABLE `users` MODIFY COLUMN `name` VARCHAR(100) NOT NULL DEFAULT ''",
                plan.getStatements().get(0).getSql());
        List<String> warnings = plan.getWarnings();
        assertTrue(warnings.stream().anyMatch(w -> w.contains("may cause data loss or conversion errors")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("is narrowed")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("from nullable to NOT NULL")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("Default value change")));
    }

    @Test
    @DisplayName("Adding a NOT NULL column without default warns, AUTO_INCREMENT does not")
    void notNullWithoutDefault() {
        TableDiff tableDiff = TableDiff.builder()
                .tableName("users")
                .addedColumns(List.of(column("age", "INT", false, 3), idColumn()))
                .build();

        MigrationPlan plan = planner.plan(SchemaDiff.builder().modifiedTables(List.of(tableDiff)).build());

        assertEquals(1, plan.getWarnings().stream().filter(w -> w.contains("without default value")).count());
        assertTrue(plan.getWarnings().get(0).contains("'users.age'"));
    }

    @Test
    @DisplayName("Summary counts distinct tables touched by column statements")
    void summary() {
        TableDiff users = TableDiff.builder().tableName("users")
                .addedColumns(List.of(column("a", "INT", true, 3), column("b", "INT", true, 4)))
                .build();
        TableDiff orders = TableDiff.builder().tableName("orders")
                .removedColumns(List.of(column("total", "DECIMAL(10,2)", true, 3)))
                .build();

        MigrationSummary summary = planner.plan(SchemaDiff.builder().modifiedTables(List.of(users, orders)).build())
                .getSummary();

        assertEquals(3, summary.getTotalStatements());
        assertEquals(2, summary.getColumnsAdded());
        assertEquals(1, summary.getColumnsRemoved());
        assertEquals(2, summary.getTablesModified());
        assertEquals(1, summary.getDestructiveCount());
    }

    @Test
    @DisplayName("Dependency problems surface as warnings")
    void dependencyWarnings() {
        TableDiff orders = TableDiff.builder().tableName("orders")
                .addedConstraints(List.of(foreignKey("fk_orders_legacy", "orders", "user_id", "legacy", "id")))
                .build();
        Table legacy = Table.builder().name("legacy").build().addColumn(idColumn());
        SchemaDiff diff = SchemaDiff.builder()
                .removedTables(List.of(legacy))
                .modifiedTables(List.of(orders))
                .build();

        MigrationPlan plan = planner.plan(diff);

        assertTrue(plan.getWarnings().stream().anyMatch(w -> w.contains("references table 'legacy', which is being dropped")));
    }

    @Test
    @DisplayName("Validating an empty plan fails with a validation error")
    void validateEmptyPlan() {
        SchemaSyncException ex = assertThrows(SchemaSyncException.class, () -> planner.validate(new MigrationPlan()));
        assertEquals(ErrorType.VALIDATION, ex.getType());
        assertFalse(ex.isRecoverable());
    }
}
