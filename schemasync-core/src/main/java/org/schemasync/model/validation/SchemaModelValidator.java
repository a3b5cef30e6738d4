package org.schemasync.model.validation;

import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.dialect.mysql.MySqlUtil;
import org.schemasync.model.Column;
import org.schemasync.model.Constraint;
import org.schemasync.model.ConstraintType;
import org.schemasync.model.Index;
import org.schemasync.model.Schema;
import org.schemasync.model.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural checks for a schema snapshot loaded from outside (JSON files, third-party extractors).
 * Snapshots read from a live server are trusted and do not go through here.
 */
public class SchemaModelValidator {

    /**
     * @throws SchemaSyncException VALIDATION listing every problem found
     */
    public void validate(Schema schema) {
        List<String> errors = collectErrors(schema);
        if (!errors.isEmpty()) {
            String name = schema == null ? "<null>" : schema.getName();
            throw SchemaSyncException.validation("invalid schema '" + name + "': " + String.join("; ", errors))
                    .withContext("errors", List.copyOf(errors));
        }
    }

    public List<String> collectErrors(Schema schema) {
        List<String> errors = new ArrayList<>();
        if (schema == null) {
            errors.add("schema cannot be null");
            return errors;
        }
        for (Map.Entry<String, Table> entry : schema.getTables().entrySet()) {
            Table table = entry.getValue();
            if (table == null) {
                errors.add("table '" + entry.getKey() + "' is null");
                continue;
            }
            if (!Objects.equals(entry.getKey(), table.getName())) {
                errors.add("table key '" + entry.getKey() + "' does not match table name '" + table.getName() + "'");
            }
            validateTable(table, errors);
        }
        return errors;
    }

    void validateTable(Table table, List<String> errors) {
        String t = table.getName();
        if (isBlank(t)) {
            errors.add("table name cannot be empty");
            return;
        }
        if (table.getColumns().isEmpty()) {
            errors.add("table " + t + " must have at least one column");
        }
        table.getColumns().values().forEach(c -> validateColumn(t, c, errors));

        for (Index index : table.getIndexes()) {
            validateIndex(table, index, errors);
        }
        for (Constraint constraint : table.getConstraints().values()) {
            validateConstraint(table, constraint, errors);
        }
    }

    private void validateColumn(String table, Column column, List<String> errors) {
        if (isBlank(column.getName())) {
            errors.add("column name cannot be empty in table " + table);
            return;
        }
        if (isBlank(column.getDataType())) {
            errors.add("column " + table + "." + column.getName() + " must have a data type");
        } else if (!MySqlUtil.isKnownDataType(column.getDataType())) {
            errors.add("column " + table + "." + column.getName() + " has invalid data type: " + column.getDataType());
        }
    }

    private void validateIndex(Table table, Index index, List<String> errors) {
        if (isBlank(index.getName())) {
            errors.add("index name cannot be empty in table " + table.getName());
            return;
        }
        String where = "index " + index.getName() + " on " + table.getName();
        if (!Objects.equals(index.getTableName(), table.getName())) {
            errors.add(where + " belongs to table '" + index.getTableName() + "'");
        }
        if (index.getColumns().isEmpty()) {
            errors.add(where + " must have at least one column");
        }
        index.getColumns().stream()
                .filter(c -> !table.getColumns().containsKey(c))
                .forEach(c -> errors.add(where + " references unknown column " + c));
        if (!MySqlUtil.isKnownIndexType(index.getIndexType())) {
            errors.add(where + " has invalid index type: " + index.getIndexType());
        }
    }

    private void validateConstraint(Table table, Constraint constraint, List<String> errors) {
        if (isBlank(constraint.getName())) {
            errors.add("constraint name cannot be empty in table " + table.getName());
            return;
        }
        String where = "constraint " + constraint.getName() + " on " + table.getName();
        if (!Objects.equals(constraint.getTableName(), table.getName())) {
            errors.add(where + " belongs to table '" + constraint.getTableName() + "'");
        }
        if (constraint.getType() == null) {
            errors.add(where + " must have a type");
            return;
        }
        if (constraint.getType() != ConstraintType.CHECK && constraint.getColumns().isEmpty()) {
            errors.add(where + " must have at least one column");
        }
        constraint.getColumns().stream()
                .filter(c -> !table.getColumns().containsKey(c))
                .forEach(c -> errors.add(where + " references unknown column " + c));

        switch (constraint.getType()) {
            case FOREIGN_KEY -> {
                if (isBlank(constraint.getReferencedTable())) {
                    errors.add(where + " must have a referenced table");
                }
                if (constraint.getReferencedColumns().isEmpty()) {
                    errors.add(where + " must have referenced columns");
                } else if (constraint.getReferencedColumns().size() != constraint.getColumns().size()) {
                    errors.add(where + " column count does not match referenced column count");
                }
            }
            case CHECK -> {
                if (isBlank(constraint.getCheckExpression())) {
                    errors.add(where + " must have a check expression");
                }
            }
            case UNIQUE -> {
                // columns already checked
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
