package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A table column. {@code defaultValue == null} means "no default", which is not the same as an empty string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Column {
    @JsonProperty("name")
    private String name;

    @JsonProperty("data_type")
    private String dataType;

    @Builder.Default
    @JsonProperty("is_nullable")
    private boolean nullable = true;

    @Builder.Default
    @JsonProperty("default_value")
    private String defaultValue = null;

    @Builder.Default
    @JsonProperty("extra")
    private String extra = "";

    @JsonProperty("position")
    private int position;
}
