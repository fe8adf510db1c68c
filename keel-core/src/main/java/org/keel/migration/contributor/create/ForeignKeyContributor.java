package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.TableBodyContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ForeignKeyModel;

import java.util.List;

/**
 * Foreign keys declared inline in {@code CREATE TABLE}.
 */
public record ForeignKeyContributor(List<ForeignKeyModel> foreignKeys) implements DdlContributor, TableBodyContributor {
    @Override
    public int priority() {
        return ADD_FOREIGN_KEY;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ForeignKeyModel fk : foreignKeys) {
            sb.append("  ").append(dialect.getForeignKeyDefinitionSql(fk)).append(",\n");
        }
    }
}
