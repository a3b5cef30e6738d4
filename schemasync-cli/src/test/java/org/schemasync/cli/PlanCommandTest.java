package org.schemasync.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PlanCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new PlanCommand())
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
    }

    @Test
    @DisplayName("Identical snapshots report that schemas are in sync")
    void inSync() throws IOException {
        Path source = Snapshots.write(tempDir, "source.json", Snapshots.USERS);
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);

        int exitCode = cmd.execute("-s", source.toString(), "-t", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Schemas are already in sync.");
    }

    @Test
    @DisplayName("Differences are printed as SQL statements")
    void printsSql() throws IOException {
        Path source = Snapshots.write(tempDir, "source.json", Snapshots.USERS_WITH_EMAIL);
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);

        int exitCode = cmd.execute("--source", source.toString(), "--target", target.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("-- Add column email to table users")
                .contains("ALTER TABLE `users` ADD COLUMN `email` VARCHAR(255)")
                .doesNotContain(";;");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("--json prints the plan as JSON")
    void printsJson() throws IOException {
        Path source = Snapshots.write(tempDir, "source.json", Snapshots.USERS_WITH_EMAIL);
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);

        int exitCode = cmd.execute("-s", source.toString(), "-t", target.toString(), "--json");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"statements\"", "ADD COLUMN");
    }

    @Test
    @DisplayName("--out writes a timestamped migration script")
    void writesScript() throws IOException {
        Path source = Snapshots.write(tempDir, "source.json", Snapshots.USERS_WITH_EMAIL);
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);
        Path outDir = tempDir.resolve("migrations");

        int exitCode = cmd.execute("-s", source.toString(), "-t", target.toString(), "--out", outDir.toString());

        assertThat(exitCode).isZero();
        List<Path> scripts;
        try (Stream<Path> files = Files.list(outDir)) {
            scripts = files.collect(Collectors.toList());
        }
        assertThat(scripts).hasSize(1);
        assertThat(scripts.get(0).getFileName().toString()).matches("migration-\\d{14}\\.sql");
        assertThat(Files.readString(scripts.get(0)))
                .startsWith("-- SchemaSync Migration")
                .contains("ADD COLUMN `email`");
        assertThat(out.toString()).contains("Migration script written to");
    }

    @Test
    @DisplayName("A missing snapshot fails with exit 1")
    void missingSnapshot() throws IOException {
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);

        int exitCode = cmd.execute("-s", tempDir.resolve("nope.json").toString(), "-t", target.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Plan failed: Schema snapshot not found", "path:");
    }

    @Test
    @DisplayName("An inconsistent snapshot is rejected before planning")
    void invalidSnapshot() throws IOException {
        Path source = Snapshots.write(tempDir, "source.json", Snapshots.INVALID_TYPE);
        Path target = Snapshots.write(tempDir, "target.json", Snapshots.USERS);

        int exitCode = cmd.execute("-s", source.toString(), "-t", target.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("has invalid data type: VARCHAR2(10)");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Source and target are required")
    void requiredOptions() {
        int exitCode = cmd.execute("-s", "only-source.json");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--target");
    }
}
