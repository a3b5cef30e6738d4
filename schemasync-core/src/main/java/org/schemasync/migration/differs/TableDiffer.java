package org.schemasync.migration.differs;

import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;

import java.util.Map;
import java.util.Optional;

/**
 * Tables only in the source are added; tables only in the target are removed.
 */
public class TableDiffer implements Differ {

    @Override
    public void diff(Schema source, Schema target, SchemaDiff result) {
        Map<String, Table> sourceTables = Optional.ofNullable(source.getTables()).orElseGet(Map::of);
        Map<String, Table> targetTables = Optional.ofNullable(target.getTables()).orElseGet(Map::of);

        sourceTables.forEach((name, table) -> {
            if (!targetTables.containsKey(name)) {
                result.getAddedTables().add(table);
            }
        });
        targetTables.forEach((name, table) -> {
            if (!sourceTables.containsKey(name)) {
                result.getRemovedTables().add(table);
            }
        });
    }
}
