package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural delta between a source and a target schema. "Added" objects exist only in the source and are to be
 * created on the target; "removed" objects exist only in the target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDiff {
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("added_tables")
    private List<Table> addedTables = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("removed_tables")
    private List<Table> removedTables = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("modified_tables")
    private List<TableDiff> modifiedTables = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("added_indexes")
    private List<Index> addedIndexes = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("removed_indexes")
    private List<Index> removedIndexes = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("added_constraints")
    private List<Constraint> addedConstraints = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("removed_constraints")
    private List<Constraint> removedConstraints = new ArrayList<>();

    /**
     * Advisory notes from the differ (possible renames). Not a structural delta.
     */
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    /**
     * True iff no structural delta exists, including inside every nested {@link TableDiff}.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return addedTables.isEmpty()
                && removedTables.isEmpty()
                && modifiedTables.stream().allMatch(TableDiff::isEmpty)
                && addedIndexes.isEmpty()
                && removedIndexes.isEmpty()
                && addedConstraints.isEmpty()
                && removedConstraints.isEmpty();
    }

    @JsonIgnore
    public Stats stats() {
        Stats stats = new Stats();
        stats.tablesAdded = addedTables.size();
        stats.tablesRemoved = removedTables.size();
        stats.indexesAdded = addedIndexes.size();
        stats.indexesRemoved = removedIndexes.size();
        stats.constraintsAdded = addedConstraints.size();
        stats.constraintsRemoved = removedConstraints.size();
        for (TableDiff td : modifiedTables) {
            if (td.isEmpty()) {
                continue;
            }
            stats.tablesModified++;
            stats.columnsAdded += td.getAddedColumns().size();
            stats.columnsRemoved += td.getRemovedColumns().size();
            stats.columnsModified += td.getModifiedColumns().size();
            stats.constraintsAdded += td.getAddedConstraints().size();
            stats.constraintsRemoved += td.getRemovedConstraints().size();
        }
        return stats;
    }

    /**
     * Per-category change counts.
     */
    @Data
    public static class Stats {
        private int tablesAdded;
        private int tablesRemoved;
        private int tablesModified;
        private int columnsAdded;
        private int columnsRemoved;
        private int columnsModified;
        private int indexesAdded;
        private int indexesRemoved;
        private int constraintsAdded;
        private int constraintsRemoved;

        public int total() {
            return tablesAdded + tablesRemoved + tablesModified
                    + columnsAdded + columnsRemoved + columnsModified
                    + indexesAdded + indexesRemoved
                    + constraintsAdded + constraintsRemoved;
        }
    }
}
