package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Constraint {
    @JsonProperty("name")
    private String name;

    @JsonProperty("table_name")
    private String tableName;

    @JsonProperty("type")
    private ConstraintType type;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    // foreign key only
    @JsonProperty("referenced_table")
    private String referencedTable;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("referenced_columns")
    private List<String> referencedColumns = new ArrayList<>();

    @JsonProperty("on_update")
    private String onUpdate;

    @JsonProperty("on_delete")
    private String onDelete;

    // check only
    @JsonProperty("check_expression")
    private String checkExpression;
}
