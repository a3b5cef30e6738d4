package org.schemasync.migration;

import org.schemasync.model.Column;
import org.schemasync.model.Constraint;
import org.schemasync.model.ConstraintType;
import org.schemasync.model.Index;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds changes inside one diff that contradict each other: objects being added that depend on tables or
 * columns being removed.
 */
public class ChangeValidator {

    public List<String> findDependencyProblems(SchemaDiff diff) {
        List<String> problems = new ArrayList<>();

        Set<String> removedTables = new HashSet<>();
        diff.getRemovedTables().forEach(t -> removedTables.add(t.getName()));

        Map<String, Set<String>> removedColumns = new HashMap<>();
        for (TableDiff td : diff.getModifiedTables()) {
            for (Column c : td.getRemovedColumns()) {
                removedColumns.computeIfAbsent(td.getTableName(), k -> new HashSet<>()).add(c.getName());
            }
        }

        for (Constraint c : addedConstraints(diff)) {
            if (c.getType() == ConstraintType.FOREIGN_KEY) {
                if (removedTables.contains(c.getReferencedTable())) {
                    problems.add(String.format("Foreign key '%s' on table '%s' references table '%s', which is being dropped",
                            c.getName(), c.getTableName(), c.getReferencedTable()));
                }
                for (String ref : c.getReferencedColumns()) {
                    if (removedColumns.getOrDefault(c.getReferencedTable(), Set.of()).contains(ref)) {
                        problems.add(String.format("Foreign key '%s' on table '%s' references column '%s.%s', which is being dropped",
                                c.getName(), c.getTableName(), c.getReferencedTable(), ref));
                    }
                }
            }
            for (String col : c.getColumns()) {
                if (removedColumns.getOrDefault(c.getTableName(), Set.of()).contains(col)) {
                    problems.add(String.format("Constraint '%s' on table '%s' uses column '%s', which is being dropped",
                            c.getName(), c.getTableName(), col));
                }
            }
        }

        for (Index index : diff.getAddedIndexes()) {
            for (String col : index.getColumns()) {
                if (removedColumns.getOrDefault(index.getTableName(), Set.of()).contains(col)) {
                    problems.add(String.format("Index '%s' on table '%s' uses column '%s', which is being dropped",
                            index.getName(), index.getTableName(), col));
                }
            }
        }
        return problems;
    }

    private static List<Constraint> addedConstraints(SchemaDiff diff) {
        List<Constraint> all = new ArrayList<>(diff.getAddedConstraints());
        diff.getModifiedTables().forEach(td -> all.addAll(td.getAddedConstraints()));
        for (Table t : diff.getAddedTables()) {
            all.addAll(t.getConstraints().values());
        }
        return all;
    }
}
