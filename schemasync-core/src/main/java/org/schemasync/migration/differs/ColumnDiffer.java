package org.schemasync.migration.differs;

import org.schemasync.model.Column;
import org.schemasync.model.ColumnDiff;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.Locale;
import java.util.Objects;

/**
 * Columns are matched by name. A same-named column with a different type, nullability, default or extra is
 * reported as modified, never as a drop/add pair.
 */
public class ColumnDiffer implements TableComponentDiffer {

    @Override
    public void diff(Table source, Table target, TableDiff tableDiff, SchemaDiff result) {
        source.getColumns().forEach((name, sourceColumn) -> {
            Column targetColumn = target.getColumns().get(name);
            if (targetColumn == null) {
                tableDiff.getAddedColumns().add(sourceColumn);
            } else if (!sameDefinition(sourceColumn, targetColumn)) {
                tableDiff.getModifiedColumns().add(ColumnDiff.builder()
                        .columnName(name)
                        .oldColumn(targetColumn)
                        .newColumn(sourceColumn)
                        .build());
            }
        });
        target.getColumns().forEach((name, targetColumn) -> {
            if (!source.getColumns().containsKey(name)) {
                tableDiff.getRemovedColumns().add(targetColumn);
            }
        });
    }

    /**
     * Ordinal position is ignored: reordering alone does not produce a statement.
     */
    static boolean sameDefinition(Column a, Column b) {
        return Objects.equals(trim(a.getDataType()), trim(b.getDataType()))
                && a.isNullable() == b.isNullable()
                && Objects.equals(a.getDefaultValue(), b.getDefaultValue())
                && normalizeExtra(a.getExtra()).equals(normalizeExtra(b.getExtra()));
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }

    private static String normalizeExtra(String extra) {
        return extra == null ? "" : extra.trim().toUpperCase(Locale.ROOT);
    }
}
