package org.schemasync.migration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.schemasync.error.SchemaSyncException;

import java.util.ArrayList;
import java.util.List;

/**
 * One rendered DDL statement of a plan. Destructiveness follows from {@link #getType()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = {"is_destructive"}, allowGetters = true)
public class MigrationStatement {
    @JsonProperty("sql")
    private String sql;

    @JsonProperty("type")
    private StatementType type;

    @JsonProperty("description")
    private String description;

    @JsonProperty("table_name")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String tableName;

    // informational only
    @Builder.Default
    @JsonProperty("dependencies")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> dependencies = new ArrayList<>();

    @JsonProperty("is_destructive")
    public boolean isDestructive() {
        return type != null && type.isDestructive();
    }

    /**
     * @throws SchemaSyncException VALIDATION when a required field is missing
     */
    public void validate() {
        if (sql == null || sql.isBlank()) {
            throw SchemaSyncException.validation("migration statement SQL cannot be empty");
        }
        if (type == null) {
            throw SchemaSyncException.validation("migration statement type cannot be empty");
        }
        if (description == null || description.isBlank()) {
            throw SchemaSyncException.validation("migration statement description cannot be empty");
        }
    }
}
