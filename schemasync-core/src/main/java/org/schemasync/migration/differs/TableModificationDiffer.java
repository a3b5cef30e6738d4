package org.schemasync.migration.differs;

import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the per-table differs on every table present on both sides. Tables without column or constraint deltas
 * produce no {@link TableDiff}.
 */
public class TableModificationDiffer implements Differ {

    private final List<TableComponentDiffer> componentDiffers;

    public TableModificationDiffer() {
        this(List.of(new ColumnDiffer(), new ConstraintDiffer(), new IndexDiffer()));
    }

    public TableModificationDiffer(List<TableComponentDiffer> componentDiffers) {
        this.componentDiffers = List.copyOf(Objects.requireNonNull(componentDiffers, "componentDiffers must not be null"));
    }

    @Override
    public void diff(Schema source, Schema target, SchemaDiff result) {
        Map<String, Table> sourceTables = Optional.ofNullable(source.getTables()).orElseGet(Map::of);
        Map<String, Table> targetTables = Optional.ofNullable(target.getTables()).orElseGet(Map::of);

        sourceTables.forEach((name, sourceTable) -> {
            Table targetTable = targetTables.get(name);
            if (targetTable == null) {
                return;
            }
            TableDiff tableDiff = compareTables(sourceTable, targetTable, result);
            if (!tableDiff.isEmpty()) {
                result.getModifiedTables().add(tableDiff);
            }
        });
    }

    public TableDiff compareTables(Table source, Table target, SchemaDiff result) {
        TableDiff tableDiff = TableDiff.builder().tableName(source.getName()).build();
        for (TableComponentDiffer differ : componentDiffers) {
            differ.diff(source, target, tableDiff, result);
        }
        return tableDiff;
    }
}
