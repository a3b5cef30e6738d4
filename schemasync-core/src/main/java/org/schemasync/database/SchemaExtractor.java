package org.schemasync.database;

import org.schemasync.model.Schema;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Reads a {@link Schema} snapshot from a live database. The returned snapshot is trusted to be internally
 * consistent. Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface SchemaExtractor {

    Schema extractSchema(Connection connection, String databaseName) throws SQLException;
}
