package org.schemasync.model;

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
public class Index {
    public static final String DEFAULT_TYPE = "BTREE";

    @JsonProperty("name")
    private String name;

    @JsonProperty("table_name")
    private String tableName;

    // order defines the composite key
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("is_unique")
    private boolean unique;

    @JsonProperty("is_primary")
    private boolean primary;

    @Builder.Default
    @JsonProperty("index_type")
    private String indexType = DEFAULT_TYPE;
}
