package org.keel.migration.contributor.drop;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ForeignKeyModel;

public record ForeignKeyDropContributor(String table, ForeignKeyModel fk) implements DdlContributor {
    @Override
    public int priority() {
        return DROP_FOREIGN_KEY;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropForeignKeySql(table, fk));
    }
}
