package org.schemasync.migration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Counts derived from a list of statements. Instances are never mutated after {@link #of(Collection)}.
 */
@Getter
public final class MigrationSummary {
    @JsonProperty("total_statements")
    private int totalStatements;
    @JsonProperty("destructive_count")
    private int destructiveCount;
    @JsonProperty("tables_added")
    private int tablesAdded;
    @JsonProperty("tables_removed")
    private int tablesRemoved;
    @JsonProperty("tables_modified")
    private int tablesModified;
    @JsonProperty("columns_added")
    private int columnsAdded;
    @JsonProperty("columns_removed")
    private int columnsRemoved;
    @JsonProperty("columns_modified")
    private int columnsModified;
    @JsonProperty("indexes_added")
    private int indexesAdded;
    @JsonProperty("indexes_removed")
    private int indexesRemoved;
    @JsonProperty("constraints_added")
    private int constraintsAdded;
    @JsonProperty("constraints_removed")
    private int constraintsRemoved;

    private MigrationSummary() {
    }

    public static MigrationSummary empty() {
        return new MigrationSummary();
    }

    public static MigrationSummary of(Collection<MigrationStatement> statements) {
        MigrationSummary s = new MigrationSummary();
        Set<String> modifiedTables = new HashSet<>();
        for (MigrationStatement stmt : statements) {
            s.totalStatements++;
            if (stmt.isDestructive()) {
                s.destructiveCount++;
            }
            if (stmt.getType() == null) {
                continue;
            }
            switch (stmt.getType()) {
                case CREATE_TABLE -> s.tablesAdded++;
                case DROP_TABLE -> s.tablesRemoved++;
                case ADD_COLUMN -> {
                    s.columnsAdded++;
                    addTable(modifiedTables, stmt);
                }
                case DROP_COLUMN -> {
                    s.columnsRemoved++;
                    addTable(modifiedTables, stmt);
                }
                case MODIFY_COLUMN -> {
                    s.columnsModified++;
                    addTable(modifiedTables, stmt);
                }
                case CREATE_INDEX -> s.indexesAdded++;
                case DROP_INDEX -> s.indexesRemoved++;
                case ADD_CONSTRAINT -> s.constraintsAdded++;
                case DROP_CONSTRAINT -> s.constraintsRemoved++;
            }
        }
        s.tablesModified = modifiedTables.size();
        return s;
    }

    private static void addTable(Set<String> tables, MigrationStatement stmt) {
        if (stmt.getTableName() != null && !stmt.getTableName().isEmpty()) {
            tables.add(stmt.getTableName());
        }
    }
}
