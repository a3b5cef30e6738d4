package org.schemasync.execution;

import org.schemasync.migration.MigrationStatement;

/**
 * Observer for pipeline progress. Implementations must not throw; the pipeline does not depend on them.
 */
public interface ProgressReporter {

    ProgressReporter NONE = new ProgressReporter() {
    };

    default void phase(String description) {
    }

    /**
     * @param index 1-based position of the statement in the plan
     */
    default void statement(int index, int total, MigrationStatement statement) {
    }
}
