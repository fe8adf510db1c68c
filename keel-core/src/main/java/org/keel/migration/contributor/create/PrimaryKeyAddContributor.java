package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;

/**
 * Adds the new primary key once column changes are done and before indexes are created.
 */
public record PrimaryKeyAddContributor(String tableName, ChangeSet.PrimaryKeyChange change) implements DdlContributor {

    @Override
    public int priority() {
        return ADD_PRIMARY_KEY;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (!change.getNewColumns().isEmpty()) {
            sb.append(dialect.getAddPrimaryKeySql(tableName, change.getNewColumns()));
        }
    }
}
