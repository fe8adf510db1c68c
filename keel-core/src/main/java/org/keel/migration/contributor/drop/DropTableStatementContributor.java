package org.keel.migration.contributor.drop;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.TableModel;

public record DropTableStatementContributor(TableModel table) implements DdlContributor {
    @Override
    public int priority() {
        return DROP_TABLE;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropTableSql(table.getTableName()));
    }
}
