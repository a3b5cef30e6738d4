package org.schemasync.migration.dialect.mysql;

import org.schemasync.migration.spi.IdentifierPolicy;

class MySqlIdentifierPolicy implements IdentifierPolicy {
    public int maxLength()          { return 64; }
    public String quote(String raw) { return "`" + raw.replace("`", "``") + "`"; }
}
