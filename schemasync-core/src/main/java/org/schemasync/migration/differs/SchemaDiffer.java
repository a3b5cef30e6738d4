package org.schemasync.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;

import java.util.List;
import java.util.Objects;

/**
 * Diff engine. Runs a fixed pipeline of {@link Differ}s over a source (desired) and a target (current) schema.
 */
@Slf4j
public class SchemaDiffer {
    private final List<Differ> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<Differ> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * Pipeline order:
     * 1. TableDiffer (added/removed tables)
     * 2. TableModificationDiffer (columns, constraints, indexes of common tables)
     * 3. RenameDetector (warnings only)
     */
    private static List<Differ> createDefaultDiffers() {
        return List.of(
                new TableDiffer(),
                new TableModificationDiffer(),
                new RenameDetector()
        );
    }

    public SchemaDiff compare(Schema source, Schema target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        SchemaDiff result = SchemaDiff.builder().build();
        for (Differ differ : differs) {
            differ.diff(source, target, result);
        }

        if (log.isDebugEnabled()) {
            SchemaDiff.Stats stats = result.stats();
            log.debug("Compared '{}' -> '{}': tables +{} -{} ~{}, indexes +{} -{}",
                    source.getName(), target.getName(),
                    stats.getTablesAdded(), stats.getTablesRemoved(), stats.getTablesModified(),
                    stats.getIndexesAdded(), stats.getIndexesRemoved());
        }
        return result;
    }
}
