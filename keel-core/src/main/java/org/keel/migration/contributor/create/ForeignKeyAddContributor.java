package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.PostCreateContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ForeignKeyModel;

public record ForeignKeyAddContributor(String table, ForeignKeyModel fk) implements DdlContributor, PostCreateContributor {
    @Override
    public int priority() {
        return ADD_FOREIGN_KEY;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getAddForeignKeySql(table, fk));
    }
}
