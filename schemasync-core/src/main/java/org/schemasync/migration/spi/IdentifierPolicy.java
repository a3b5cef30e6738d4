package org.schemasync.migration.spi;

public interface IdentifierPolicy {
    int maxLength();
    String quote(String raw);
}
