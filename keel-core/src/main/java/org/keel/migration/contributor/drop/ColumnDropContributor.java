package org.keel.migration.contributor.drop;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;

public record ColumnDropContributor(String tableName, ColumnModel column) implements DdlContributor {
    @Override
    public int priority() {
        return DROP_COLUMN;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropColumnSql(tableName, column));
    }
}
