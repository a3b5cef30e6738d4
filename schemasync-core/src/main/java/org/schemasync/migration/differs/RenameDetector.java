package org.schemasync.migration.differs;

import org.schemasync.model.Column;
import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pairs removed and added tables whose columns are nearly identical and records a warning for each pair.
 * Statements are not affected: a probable rename is still planned as drop plus create.
 */
public class RenameDetector implements Differ {

    static final double SIMILARITY_THRESHOLD = 0.8;

    @Override
    public void diff(Schema source, Schema target, SchemaDiff result) {
        detect(result).forEach((removed, added) -> result.getWarnings().add(String.format(
                "Table '%s' may have been renamed to '%s'; it will be dropped and recreated, and its data will not be carried over",
                removed, added)));
    }

    /**
     * @return removed table name to added table name
     */
    public Map<String, String> detect(SchemaDiff diff) {
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, Table> candidates = new LinkedHashMap<>();
        diff.getRemovedTables().forEach(t -> candidates.put(t.getName(), t));

        for (Table added : diff.getAddedTables()) {
            String best = null;
            double bestScore = 0.0;
            for (Table removed : candidates.values()) {
                double score = similarity(added, removed);
                if (score > bestScore && score > SIMILARITY_THRESHOLD) {
                    bestScore = score;
                    best = removed.getName();
                }
            }
            if (best != null) {
                renames.put(best, added.getName());
                candidates.remove(best);
            }
        }
        return renames;
    }

    /**
     * Share of identical columns, relative to the larger of the two tables.
     */
    static double similarity(Table a, Table b) {
        int sizeA = a.getColumns().size();
        int sizeB = b.getColumns().size();
        if (sizeA == 0 && sizeB == 0) {
            return 1.0;
        }
        if (sizeA == 0 || sizeB == 0) {
            return 0.0;
        }
        int matching = 0;
        for (Map.Entry<String, Column> e : a.getColumns().entrySet()) {
            Column other = b.getColumns().get(e.getKey());
            if (other != null && ColumnDiffer.sameDefinition(e.getValue(), other)) {
                matching++;
            }
        }
        return (double) matching / Math.max(sizeA, sizeB);
    }
}
