package org.keel.migration.contributor.alter;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;

/**
 * Rebuilds a table for providers that cannot alter it in place.
 */
public record TableRedefineContributor(ChangeSet.AlteredTable table) implements DdlContributor {
    @Override
    public int priority() {
        return REDEFINE_TABLE;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getRedefineTableSql(table));
    }
}
