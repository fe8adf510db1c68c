package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.IndexModel;

public record IndexAddContributor(String tableName, IndexModel index) implements DdlContributor {
    @Override
    public int priority() {
        return ADD_INDEX;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.indexStatement(index, tableName));
    }
}
