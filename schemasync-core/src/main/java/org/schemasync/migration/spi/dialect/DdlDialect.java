package org.schemasync.migration.spi.dialect;

import org.schemasync.migration.SchemaChange;
import org.schemasync.migration.spi.visitor.SchemaChangeVisitor;

import java.util.Objects;

/**
 * Renders each {@link SchemaChange} variant as one DDL statement. Implementations reject missing or empty
 * required objects with {@link IllegalArgumentException}.
 */
public interface DdlDialect extends SchemaChangeVisitor<String> {

    String quoteIdentifier(String raw);

    default String render(SchemaChange change) {
        Objects.requireNonNull(change, "change must not be null");
        return change.accept(this);
    }
}
