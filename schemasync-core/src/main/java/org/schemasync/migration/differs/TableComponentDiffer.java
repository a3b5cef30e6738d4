package org.schemasync.migration.differs;

import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

/**
 * Compares one aspect of a table present on both sides. Column and constraint deltas go to {@code tableDiff};
 * index deltas are schema-level and go to {@code result}.
 */
@FunctionalInterface
public interface TableComponentDiffer {
    void diff(Table source, Table target, TableDiff tableDiff, SchemaDiff result);
}
