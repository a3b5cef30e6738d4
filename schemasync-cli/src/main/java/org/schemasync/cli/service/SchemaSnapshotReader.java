package org.schemasync.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.schemasync.error.ErrorType;
import org.schemasync.error.SchemaSyncException;
import org.schemasync.migration.MigrationPlan;
import org.schemasync.model.Schema;
import org.schemasync.model.validation.SchemaModelValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads schema snapshot JSON files and renders plans as JSON.
 */
public class SchemaSnapshotReader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final SchemaModelValidator validator = new SchemaModelValidator();

    /**
     * Loads and validates a snapshot. A snapshot without a name takes the file name.
     *
     * @throws SchemaSyncException VALIDATION when the file is missing or the snapshot is inconsistent
     * @throws IOException         when the file cannot be read or parsed
     */
    public Schema read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw SchemaSyncException.validation("Schema snapshot not found: " + path)
                    .withContext("path", path.toString());
        }
        Schema schema;
        try {
            schema = objectMapper.readValue(path.toFile(), Schema.class);
        } catch (JsonProcessingException e) {
            throw new SchemaSyncException(ErrorType.VALIDATION,
                    "Invalid schema snapshot " + path + ": " + e.getOriginalMessage(), e)
                    .withContext("path", path.toString());
        }
        if (schema == null) {
            throw new SchemaSyncException(ErrorType.SCHEMA, "Schema snapshot is empty: " + path);
        }
        if (schema.getName() == null || schema.getName().isBlank()) {
            schema.setName(path.getFileName().toString().replaceFirst("\\.json$", ""));
        }
        validator.validate(schema);
        return schema;
    }

    public String toJson(MigrationPlan plan) throws IOException {
        return objectMapper.writeValueAsString(plan);
    }
}
