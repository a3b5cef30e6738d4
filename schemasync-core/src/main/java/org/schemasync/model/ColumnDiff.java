package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A column present on both sides whose definition changed. {@code newColumn} is authoritative for SQL generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDiff {
    @JsonProperty("column_name")
    private String columnName;

    @JsonProperty("old_column")
    private Column oldColumn;

    @JsonProperty("new_column")
    private Column newColumn;
}
