package org.keel.migration.contributor.drop;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;

public record PrimaryKeyDropContributor(ChangeSet.AlteredTable table) implements DdlContributor {
    @Override
    public int priority() {
        return DROP_PRIMARY_KEY;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        sb.append(dialect.getDropPrimaryKeySql(table));
    }
}
