package org.schemasync.migration.differs;

import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;

/**
 * One stage of the diff pipeline. {@code source} is the desired state, {@code target} the state to migrate.
 */
@FunctionalInterface
public interface Differ {
    void diff(Schema source, Schema target, SchemaDiff result);
}
