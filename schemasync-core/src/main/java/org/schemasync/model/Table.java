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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Table {
    @JsonProperty("name")
    private String name;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("columns")
    private Map<String, Column> columns = new LinkedHashMap<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("indexes")
    private List<Index> indexes = new ArrayList<>();

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("constraints")
    private Map<String, Constraint> constraints = new LinkedHashMap<>();

    public Table addColumn(Column column) {
        columns.put(column.getName(), column);
        return this;
    }

    public Table addIndex(Index index) {
        indexes.add(index);
        return this;
    }

    public Table addConstraint(Constraint constraint) {
        constraints.put(constraint.getName(), constraint);
        return this;
    }

    /**
     * Columns ordered by ordinal position, then by name.
     */
    @JsonIgnore
    public List<Column> getOrderedColumns() {
        return columns.values().stream()
                .sorted(Comparator.comparingInt(Column::getPosition).thenComparing(Column::getName))
                .toList();
    }

    @JsonIgnore
    public Optional<Index> getPrimaryIndex() {
        return indexes.stream().filter(Index::isPrimary).findFirst();
    }
}
