package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of one database: its name and its tables keyed by table name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schema {
    @JsonProperty("name")
    private String name;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("tables")
    private Map<String, Table> tables = new LinkedHashMap<>();

    public static Schema of(String name, Table... tables) {
        Map<String, Table> byName = new LinkedHashMap<>();
        for (Table table : tables) {
            byName.put(table.getName(), table);
        }
        return new Schema(name, byName);
    }
}
