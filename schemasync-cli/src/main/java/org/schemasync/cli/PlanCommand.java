package org.schemasync.cli;

import org.schemasync.cli.service.SchemaSnapshotReader;
import org.schemasync.error.ErrorClassifier;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.MigrationPlan;
import org.schemasync.migration.MigrationPlanner;
import org.schemasync.migration.MigrationStatement;
import org.schemasync.migration.differs.SchemaDiffer;
import org.schemasync.migration.output.SqlScriptWriter;
import org.schemasync.model.Schema;
import org.schemasync.model.SchemaDiff;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Offline planning between two schema snapshot files.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Generates the migration SQL that turns the target snapshot into the source snapshot."
)
public class PlanCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-s", "--source"}, required = true, description = "Desired schema snapshot (JSON)")
    private Path sourcePath;
    @CommandLine.Option(names = {"-t", "--target"}, required = true, description = "Current schema snapshot (JSON)")
    private Path targetPath;
    @CommandLine.Option(names = "--out", description = "Directory to write the migration-<timestamp>.sql script to")
    private Path outputDir;
    @CommandLine.Option(names = "--json", description = "Print the plan as JSON instead of SQL")
    private boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SchemaSnapshotReader reader = new SchemaSnapshotReader();
            Schema source = reader.read(sourcePath);
            Schema target = reader.read(targetPath);

            SchemaDiff diff = new SchemaDiffer().compare(source, target);
            if (diff.isEmpty()) {
                out.println("Schemas are already in sync.");
                diff.getWarnings().forEach(w -> out.println("Warning: " + w));
                return 0;
            }

            MigrationPlanner planner = new MigrationPlanner();
            MigrationPlan plan = planner.plan(diff);
            planner.validate(plan);

            if (json) {
                out.println(reader.toJson(plan));
            } else {
                printPlan(out, plan);
            }

            if (outputDir != null) {
                Path script = new SqlScriptWriter().write(plan, outputDir);
                out.println("Migration script written to " + script);
            }
            return 0;
        } catch (Exception e) {
            SchemaSyncException error = ErrorClassifier.classify(e);
            err.println("Plan failed: " + error.getUserMessage());
            error.getContext().forEach((k, v) -> err.println("   " + k + ": " + v));
            return 1;
        }
    }

    private void printPlan(PrintWriter out, MigrationPlan plan) {
        out.println(plan);
        out.println();
        for (MigrationStatement statement : plan.getStatements()) {
            out.println("-- " + statement.getDescription());
            out.println(statement.getSql() + ";");
        }
    }
}
