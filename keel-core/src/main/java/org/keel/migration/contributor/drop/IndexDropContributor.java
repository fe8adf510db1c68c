package org.keel.migration.contributor.drop;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.IndexModel;

/**
 * Drops an index, or the constraint behind it where the provider created one.
 */
public record IndexDropContributor(String tableName, IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return DROP_INDEX;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropIndexSql(tableName, index));
    }
}
