package org.schemasync.migration.spi.visitor;

import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.Constraint;
import org.schemasync.model.Index;
import org.schemasync.model.Table;

public interface SchemaChangeVisitor<R> {
    // Table
    R visitCreateTable(Table table);
    R visitDropTable(Table table);

    // Column
    R visitAddColumn(String tableName, Column column);
    R visitDropColumn(String tableName, Column column);
    R visitModifyColumn(String tableName, ColumnDiff diff);

    // Index
    R visitCreateIndex(Index index);
    R visitDropIndex(Index index);

    // Constraint
    R visitAddConstraint(Constraint constraint);
    R visitDropConstraint(Constraint constraint);
}
