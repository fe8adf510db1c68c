package org.keel.migration.contributor.alter;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;

public record ColumnModifyContributor(String table, ChangeSet.ColumnChange change) implements DdlContributor {
    @Override
    public int priority() {
        return MODIFY_COLUMN;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getModifyColumnSql(table, change));
    }
}
