package org.schemasync.migration.differs;

import org.schemasync.model.Constraint;
import org.schemasync.model.SchemaDiff;
import org.schemasync.model.Table;
import org.schemasync.model.TableDiff;

import java.util.Locale;
import java.util.Objects;

/**
 * Constraints are matched by name; any structural change becomes remove-old plus add-new.
 * <p>
 * Referential actions are compared after normalization: {@code RESTRICT}, {@code NO ACTION} and an unset action
 * count as the same value, as InnoDB enforces all three identically. Switching
 * between them is therefore not a modification.
 */
public class ConstraintDiffer implements TableComponentDiffer {

    @Override
    public void diff(Table source, Table target, TableDiff tableDiff, SchemaDiff result) {
        target.getConstraints().forEach((name, targetConstraint) -> {
            Constraint sourceConstraint = source.getConstraints().get(name);
            if (sourceConstraint == null || !sameStructure(sourceConstraint, targetConstraint)) {
                tableDiff.getRemovedConstraints().add(targetConstraint);
            }
        });
        source.getConstraints().forEach((name, sourceConstraint) -> {
            Constraint targetConstraint = target.getConstraints().get(name);
            if (targetConstraint == null || !sameStructure(sourceConstraint, targetConstraint)) {
                tableDiff.getAddedConstraints().add(sourceConstraint);
            }
        });
    }

    static boolean sameStructure(Constraint a, Constraint b) {
        return a.getType() == b.getType()
                && Objects.equals(a.getColumns(), b.getColumns())
                && Objects.equals(a.getReferencedTable(), b.getReferencedTable())
                && Objects.equals(a.getReferencedColumns(), b.getReferencedColumns())
                && normalizeAction(a.getOnUpdate()).equals(normalizeAction(b.getOnUpdate()))
                && normalizeAction(a.getOnDelete()).equals(normalizeAction(b.getOnDelete()))
                && Objects.equals(trim(a.getCheckExpression()), trim(b.getCheckExpression()));
    }

    // NO ACTION, RESTRICT and unset are equivalent in InnoDB
    private static String normalizeAction(String action) {
        if (action == null || action.isBlank()) {
            return "";
        }
        String a = action.trim().toUpperCase(Locale.ROOT);
        return a.equals("NO ACTION") || a.equals("RESTRICT") ? "" : a;
    }

    private static String trim(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
