package org.schemasync.migration.differs;

import org.schemasync.model.Index;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Indexes are matched by name. A same-named index whose columns, uniqueness, primary flag or type changed is
 * reported as removed plus added, since MySQL has no in-place index modification.
 */
public class IndexDiffer implements TableComponentDiffer {

    @Override
    public void diff(Table source, Table target, TableDiff tableDiff, SchemaDiff result) {
        Map<String, Index> sourceByName = byName(source.getIndexes());
        Map<String, Index> targetByName = byName(target.getIndexes());

        // removals first so a changed index drops before it is recreated
        targetByName.forEach((name, targetIndex) -> {
            Index sourceIndex = sourceByName.get(name);
            if (sourceIndex == null || !sameStructure(sourceIndex, targetIndex)) {
                result.getRemovedIndexes().add(withTable(targetIndex, target.getName()));
            }
        });
        sourceByName.forEach((name, sourceIndex) -> {
            Index targetIndex = targetByName.get(name);
            if (targetIndex == null || !sameStructure(sourceIndex, targetIndex)) {
                result.getAddedIndexes().add(withTable(sourceIndex, source.getName()));
            }
        });
    }

    private static Map<String, Index> byName(List<Index> indexes) {
        Map<String, Index> map = new LinkedHashMap<>();
        for (Index index : indexes) {
            map.put(index.getName(), index);
        }
        return map;
    }

    private static Index withTable(Index index, String tableName) {
        if (index.getTableName() != null && !index.getTableName().isBlank()) {
            return index;
        }
        return index.toBuilder().tableName(tableName).build();
    }

    static boolean sameStructure(Index a, Index b) {
        return Objects.equals(a.getColumns(), b.getColumns())
                && a.isUnique() == b.isUnique()
                && a.isPrimary() == b.isPrimary()
                && normalizeType(a.getIndexType()).equals(normalizeType(b.getIndexType()));
    }

    private static String normalizeType(String type) {
        return type == null || type.isBlank() ? Index.DEFAULT_TYPE : type.trim().toUpperCase(Locale.ROOT);
    }
}
