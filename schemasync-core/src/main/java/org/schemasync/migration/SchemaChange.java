package org.schemasync.migration;

import org.schemasync.migration.spi.visitor.SchemaChangeVisitor;
import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.Constraint;
import org.schemasync.model.Index;
import org.schemasync.model.Table;

/**
 * One schema object paired with the statement kind that applies it. The set of variants is closed; every
 * {@link SchemaChangeVisitor} must handle each of them.
 */
public sealed interface SchemaChange {

    StatementType type();

    /** Table the statement touches. */
    String tableName();

    <R> R accept(SchemaChangeVisitor<R> visitor);

    record CreateTable(Table table) implements SchemaChange {
        public StatementType type() { return StatementType.CREATE_TABLE; }
        public String tableName() { return table == null ? null : table.getName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitCreateTable(table); }
    }

    record DropTable(Table table) implements SchemaChange {
        public StatementType type() { return StatementType.DROP_TABLE; }
        public String tableName() { return table == null ? null : table.getName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitDropTable(table); }
    }

    record AddColumn(String tableName, Column column) implements SchemaChange {
        public StatementType type() { return StatementType.ADD_COLUMN; }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitAddColumn(tableName, column); }
    }

    record DropColumn(String tableName, Column column) implements SchemaChange {
        public StatementType type() { return StatementType.DROP_COLUMN; }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitDropColumn(tableName, column); }
    }

    record ModifyColumn(String tableName, ColumnDiff diff) implements SchemaChange {
        public StatementType type() { return StatementType.MODIFY_COLUMN; }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitModifyColumn(tableName, diff); }
    }

    record CreateIndex(Index index) implements SchemaChange {
        public StatementType type() { return StatementType.CREATE_INDEX; }
        public String tableName() { return index == null ? null : index.getTableName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitCreateIndex(index); }
    }

    record DropIndex(Index index) implements SchemaChange {
        public StatementType type() { return StatementType.DROP_INDEX; }
        public String tableName() { return index == null ? null : index.getTableName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitDropIndex(index); }
    }

    record AddConstraint(Constraint constraint) implements SchemaChange {
        public StatementType type() { return StatementType.ADD_CONSTRAINT; }
        public String tableName() { return constraint == null ? null : constraint.getTableName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitAddConstraint(constraint); }
    }

    record DropConstraint(Constraint constraint) implements SchemaChange {
        public StatementType type() { return StatementType.DROP_CONSTRAINT; }
        public String tableName() { return constraint == null ? null : constraint.getTableName(); }
        public <R> R accept(SchemaChangeVisitor<R> visitor) { return visitor.visitDropConstraint(constraint); }
    }
}
