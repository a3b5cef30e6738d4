package org.schemasync.migration.output;

import org.schemasync.migration.MigrationPlan;
import org.schemasync.migration.MigrationStatement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Writes a {@link MigrationPlan} as a runnable {@code .sql} file.
 */
public class SqlScriptWriter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    public SqlScriptWriter() {
        this(Clock.systemDefaultZone());
    }

    public SqlScriptWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return the written file, {@code migration-<yyyyMMddHHmmss>.sql} under {@code outputDir}
     */
    public Path write(MigrationPlan plan, Path outputDir) throws IOException {
        Objects.requireNonNull(plan, "plan must not be null");
        LocalDateTime now = LocalDateTime.now(clock);

        Files.createDirectories(outputDir);
        Path file = outputDir.resolve("migration-" + now.format(FILE_TIMESTAMP) + ".sql");
        Files.writeString(file, render(plan, now));
        return file;
    }

    public String render(MigrationPlan plan) {
        return render(plan, LocalDateTime.now(clock));
    }

    private String render(MigrationPlan plan, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append(generateHeader(plan, generatedAt)).append('\n');

        for (MigrationStatement statement : plan.getStatements()) {
            sb.append("-- ").append(statement.getDescription()).append('\n');
            sb.append(terminate(statement.getSql())).append("\n\n");
        }
        return sb.toString();
    }

    private String generateHeader(MigrationPlan plan, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder(String.format("""
            -- SchemaSync Migration
            -- generated=%s
            -- statements=%d
            -- destructive=%d
            """,
            generatedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            plan.getStatements().size(),
            plan.getSummary().getDestructiveCount()
        ));
        if (!plan.getWarnings().isEmpty()) {
            sb.append("-- warnings:\n");
            plan.getWarnings().forEach(w -> sb.append("--   ").append(w).append('\n'));
        }
        return sb.toString();
    }

    private static String terminate(String sql) {
        String trimmed = sql.strip();
        return trimmed.endsWith(";") ? trimmed : trimmed + ";";
    }
}
