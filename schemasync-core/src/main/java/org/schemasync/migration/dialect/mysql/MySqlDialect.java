package org.schemasync.migration.dialect.mysql;

import org.schemasync.migration.spi.IdentifierPolicy;
import org.schemasync.migration.spi.dialect.DdlDialect;
import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.Constraint;
import org.schemasync.model.Index;
import org.schemasync.model.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Back-tick quoted MySQL DDL. The produced text is exact: consumers compare it literally.
 */
public class MySqlDialect implements DdlDialect {

    private final IdentifierPolicy policy;

    public MySqlDialect() {
        this(new MySqlIdentifierPolicy());
    }

    MySqlDialect(IdentifierPolicy policy) {
        this.policy = policy;
    }

    /**
     * @throws IllegalArgumentException when the name is longer than the server accepts
     */
    @Override
    public String quoteIdentifier(String raw) {
        if (raw != null && raw.length() > policy.maxLength()) {
            throw new IllegalArgumentException(String.format("identifier '%s' exceeds %d characters",
                    raw, policy.maxLength()));
        }
        return policy.quote(raw);
    }

    // -------------------------------------------------------------------- tables

    public String createTableSql(Table table) {
        requireTable(table);
        if (table.getColumns() == null || table.getColumns().isEmpty()) {
            throw new IllegalArgumentException("table " + table.getName() + " must have at least one column");
        }

        List<String> definitions = new ArrayList<>();
        for (Column column : table.getOrderedColumns()) {
            definitions.add(columnDefinition(column));
        }
        table.getPrimaryIndex()
                .filter(pk -> !isEmpty(pk.getColumns()))
                .ifPresent(pk -> definitions.add("PRIMARY KEY (" + columnList(pk.getColumns()) + ")"));
        for (Index index : table.getIndexes()) {
            if (index.isUnique() && !index.isPrimary()) {
                definitions.add("UNIQUE KEY " + quoteIdentifier(index.getName()) + " (" + columnList(index.getColumns()) + ")");
            }
        }

        return "CREATE TABLE " + quoteIdentifier(table.getName()) + " (" + String.join(", ", definitions) + ")";
    }

    public String dropTableSql(Table table) {
        requireTable(table);
        return "DROP TABLE " + quoteIdentifier(table.getName());
    }

    // -------------------------------------------------------------------- columns

    public String addColumnSql(String tableName, Column column) {
        requireTableName(tableName);
        return alterTable(tableName) + " ADD COLUMN " + columnDefinition(column);
    }

    public String dropColumnSql(String tableName, Column column) {
        requireTableName(tableName);
        requireColumn(column);
        return alterTable(tableName) + " DROP COLUMN " + quoteIdentifier(column.getName());
    }

    /**
     * Uses the new column's full definition; the old column is informational only.
     */
    public String modifyColumnSql(String tableName, ColumnDiff diff) {
        requireTableName(tableName);
        if (diff == null) {
            throw new IllegalArgumentException("column diff cannot be null");
        }
        if (diff.getNewColumn() == null) {
            throw new IllegalArgumentException("new column cannot be null");
        }
        return alterTable(tableName) + " MODIFY COLUMN " + columnDefinition(diff.getNewColumn());
    }

    /**
     * {@code `name` TYPE NOT NULL|NULL [DEFAULT value] [EXTRA]}. The default is emitted as given.
     */
    public String columnDefinition(Column column) {
        requireColumn(column);
        if (isBlank(column.getDataType())) {
            throw new IllegalArgumentException("column data type cannot be empty: " + column.getName());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(column.getName())).append(' ').append(column.getDataType().trim());
        sb.append(column.isNullable() ? " NULL" : " NOT NULL");
        if (column.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(column.getDefaultValue());
        }
        if (!isBlank(column.getExtra())) {
            sb.append(' ').append(column.getExtra().trim());
        }
        return sb.toString();
    }

    // -------------------------------------------------------------------- indexes

    public String createIndexSql(Index index) {
        requireIndex(index);
        if (index.isPrimary()) {
            return alterTable(index.getTableName()) + " ADD PRIMARY KEY (" + columnList(index.getColumns()) + ")";
        }
        String type = index.getIndexType() == null ? "" : index.getIndexType().trim().toUpperCase(Locale.ROOT);
        String kind = switch (type) {
            case "FULLTEXT" -> "FULLTEXT ";
            case "RTREE", "SPATIAL" -> "SPATIAL ";
            default -> index.isUnique() ? "UNIQUE " : "";
        };
        String sql = "CREATE " + kind + "INDEX " + quoteIdentifier(index.getName())
                + " ON " + quoteIdentifier(index.getTableName())
                + " (" + columnList(index.getColumns()) + ")";
        if ("HASH".equals(type)) {
            sql += " USING HASH";
        }
        return sql;
    }

    public String dropIndexSql(Index index) {
        requireIndex(index);
        if (index.isPrimary()) {
            return alterTable(index.getTableName()) + " DROP PRIMARY KEY";
        }
        return "DROP INDEX " + quoteIdentifier(index.getName()) + " ON " + quoteIdentifier(index.getTableName());
    }

    // -------------------------------------------------------------------- constraints

    public String addConstraintSql(Constraint constraint) {
        requireConstraint(constraint);
        String prefix = alterTable(constraint.getTableName()) + " ADD CONSTRAINT " + quoteIdentifier(constraint.getName());
        return switch (constraint.getType()) {
            case FOREIGN_KEY -> {
                requireColumns(constraint);
                if (isBlank(constraint.getReferencedTable())) {
                    throw new IllegalArgumentException("foreign key " + constraint.getName() + " must have a referenced table");
                }
                if (isEmpty(constraint.getReferencedColumns())) {
                    throw new IllegalArgumentException("foreign key " + constraint.getName() + " must have referenced columns");
                }
                StringBuilder sb = new StringBuilder(prefix)
                        .append(" FOREIGN KEY (").append(columnList(constraint.getColumns())).append(')')
                        .append(" REFERENCES ").append(quoteIdentifier(constraint.getReferencedTable()))
                        .append(" (").append(columnList(constraint.getReferencedColumns())).append(')');
                if (!isBlank(constraint.getOnUpdate())) {
                    sb.append(" ON UPDATE ").append(constraint.getOnUpdate().trim());
                }
                if (!isBlank(constraint.getOnDelete())) {
                    sb.append(" ON DELETE ").append(constraint.getOnDelete().trim());
                }
                yield sb.toString();
            }
            case UNIQUE -> {
                requireColumns(constraint);
                yield prefix + " UNIQUE (" + columnList(constraint.getColumns()) + ")";
            }
            case CHECK -> {
                if (isBlank(constraint.getCheckExpression())) {
                    throw new IllegalArgumentException("check constraint " + constraint.getName() + " must have an expression");
                }
                yield prefix + " CHECK (" + constraint.getCheckExpression().trim() + ")";
            }
        };
    }

    /**
     * Drop grammar differs per kind: DROP FOREIGN KEY, DROP INDEX (unique), DROP CHECK.
     */
    public String dropConstraintSql(Constraint constraint) {
        requireConstraint(constraint);
        String name = quoteIdentifier(constraint.getName());
        return switch (constraint.getType()) {
            case FOREIGN_KEY -> alterTable(constraint.getTableName()) + " DROP FOREIGN KEY " + name;
            case UNIQUE -> alterTable(constraint.getTableName()) + " DROP INDEX " + name;
            case CHECK -> alterTable(constraint.getTableName()) + " DROP CHECK " + name;
        };
    }

    // -------------------------------------------------------------------- visitor

    @Override public String visitCreateTable(Table table) { return createTableSql(table); }
    @Override public String visitDropTable(Table table) { return dropTableSql(table); }
    @Override public String visitAddColumn(String tableName, Column column) { return addColumnSql(tableName, column); }
    @Override public String visitDropColumn(String tableName, Column column) { return dropColumnSql(tableName, column); }
    @Override public String visitModifyColumn(String tableName, ColumnDiff diff) { return modifyColumnSql(tableName, diff); }
    @Override public String visitCreateIndex(Index index) { return createIndexSql(index); }
    @Override public String visitDropIndex(Index index) { return dropIndexSql(index); }
    @Override public String visitAddConstraint(Constraint constraint) { return addConstraintSql(constraint); }
    @Override public String visitDropConstraint(Constraint constraint) { return dropConstraintSql(constraint); }

    // -------------------------------------------------------------------- helpers

    private String alterTable(String tableName) {
        return "ALTER TABLE " + quoteIdentifier(tableName);
    }

    private String columnList(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    private static void requireTable(Table table) {
        if (table == null) {
            throw new IllegalArgumentException("table cannot be null");
        }
        requireTableName(table.getName());
    }

    private static void requireTableName(String tableName) {
        if (isBlank(tableName)) {
            throw new IllegalArgumentException("table name cannot be empty");
        }
    }

    private static void requireColumn(Column column) {
        if (column == null) {
            throw new IllegalArgumentException("column cannot be null");
        }
        if (isBlank(column.getName())) {
            throw new IllegalArgumentException("column name cannot be empty");
        }
    }

    private static void requireIndex(Index index) {
        if (index == null) {
            throw new IllegalArgumentException("index cannot be null");
        }
        if (isBlank(index.getName())) {
            throw new IllegalArgumentException("index name cannot be empty");
        }
        if (isBlank(index.getTableName())) {
            throw new IllegalArgumentException("index table name cannot be empty");
        }
        if (isEmpty(index.getColumns())) {
            throw new IllegalArgumentException("index " + index.getName() + " must have at least one column");
        }
    }

    private static void requireConstraint(Constraint constraint) {
        if (constraint == null) {
            throw new IllegalArgumentException("constraint cannot be null");
        }
        if (isBlank(constraint.getName())) {
            throw new IllegalArgumentException("constraint name cannot be empty");
        }
        if (isBlank(constraint.getTableName())) {
            throw new IllegalArgumentException("constraint table name cannot be empty");
        }
        if (constraint.getType() == null) {
            throw new IllegalArgumentException("constraint type cannot be empty: " + constraint.getName());
        }
    }

    private static void requireColumns(Constraint constraint) {
        if (isEmpty(constraint.getColumns())) {
            throw new IllegalArgumentException("constraint " + constraint.getName() + " must have at least one column");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
