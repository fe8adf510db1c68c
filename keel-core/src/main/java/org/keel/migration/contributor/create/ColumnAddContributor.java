package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;

public record ColumnAddContributor(String tableName, ColumnModel column) implements DdlContributor {
    @Override
    public int priority() {
        return ADD_COLUMN;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getAddColumnSql(tableName, column));
    }
}
