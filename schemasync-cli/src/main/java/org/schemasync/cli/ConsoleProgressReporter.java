package org.schemasync.cli;

import org.schemasync.execution.ProgressReporter;
import org.schemasync.migration.MigrationStatement;

import java.io.PrintWriter;

/**
 * Prints pipeline progress to the command's output stream.
 */
class ConsoleProgressReporter implements ProgressReporter {

    private final PrintWriter out;

    ConsoleProgressReporter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void phase(String description) {
        out.println("==> " + description + "...");
        out.flush();
    }

    @Override
    public void statement(int index, int total, MigrationStatement statement) {
        String marker = statement.isDestructive() ? " [destructive]" : "";
        out.printf("  [%d/%d] %s%s%n", index, total, statement.getDescription(), marker);
        out.flush();
    }
}
