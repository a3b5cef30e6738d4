package org.schemasync.model.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.model.Column;
import org.schemasync.model.Constraint;
import org.schemasync.model.ConstraintType;
import org.schemasync.model.Schema;
import org.schemasync.model.Table;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.schemasync.testing.SchemaFixtures.*;

class SchemaModelValidatorTest {

    private final SchemaModelValidator validator = new SchemaModelValidator();

    @Test
    @DisplayName("Well-formed schema passes")
    void valid() {
        assertDoesNotThrow(() -> validator.validate(Schema.of("app", users(), orders())));
    }

    @Test
    @DisplayName("Unknown data type and empty table are reported together")
    void collectsAllErrors() {
        Table bad = Table.builder().name("bad").build()
                .addColumn(Column.builder().name("x").dataType("VARCHAR2(10)").build());
        Table empty = Table.builder().name("empty").build();

        List<String> errors = validator.collectErrors(Schema.of("app", bad, empty));

        assertEquals(2, errors.size(), errors.toString());
        assertTrue(errors.contains("column bad.x has invalid data type: VARCHAR2(10)"));
        assertTrue(errors.contains("table empty must have at least one column"));
    }

    @Test
    @DisplayName("Index on an unknown column with an unknown type")
    void indexProblems() {
        Table table = users().addIndex(index("idx_missing", "users", "nope").toBuilder().indexType("GIN").build());

        List<String> errors = validator.collectErrors(Schema.of("app", table));

        assertTrue(errors.contains("index idx_missing on users references unknown column nope"));
        assertTrue(errors.contains("index idx_missing on users has invalid index type: GIN"));
    }

    @Test
    @DisplayName("Foreign key arity and check expression are required")
    void constraintProblems() {
        Constraint fk = Constraint.builder().name("fk").tableName("orders").type(ConstraintType.FOREIGN_KEY)
                .columns(List.of("user_id")).referencedTable("users").referencedColumns(List.of("id", "tenant_id")).build();
        Table table = orders()
                .addConstraint(fk)
                .addConstraint(check("chk", "orders", " "));

        List<String> errors = validator.collectErrors(Schema.of("app", table));

        assertTrue(errors.contains("constraint fk on orders column count does not match referenced column count"));
        assertTrue(errors.contains("constraint chk on orders must have a check expression"));
    }

    @Test
    @DisplayName("validate throws a validation error carrying the error list")
    void validateThrows() {
        Table empty = Table.builder().name("empty").build();

        SchemaSyncException ex = assertThrows(SchemaSyncException.class, () -> validator.validate(Schema.of("app", empty)));

        assertEquals(ErrorType.VALIDATION, ex.getType());
        assertEquals(List.of("table empty must have at least one column"), ex.getContext().get("errors"));
    }
}
