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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDiff {
    @JsonProperty("table_name")
    private String tableName;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("added_columns")
    private List<Column> addedColumns = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("removed_columns")
    private List<Column> removedColumns = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("modified_columns")
    private List<ColumnDiff> modifiedColumns = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("added_constraints")
    private List<Constraint> addedConstraints = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("removed_constraints")
    private List<Constraint> removedConstraints = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return addedColumns.isEmpty()
                && removedColumns.isEmpty()
                && modifiedColumns.isEmpty()
                && addedConstraints.isEmpty()
                && removedConstraints.isEmpty();
    }
}
