package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.TableBodyContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;

import java.util.List;

public record ColumnContributor(List<String> pkColumns, List<ColumnModel> columns) implements DdlContributor, TableBodyContributor {
    @Override
    public int priority() {
        return ADD_COLUMN;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnModel c : columns) {
            sb.append("  ").append(dialect.getColumnDefinitionSql(c));
            if (c.isUnique()) {
                sb.append(" UNIQUE");
            }
            sb.append(",\n");
        }
        if (pkColumns != null && !pkColumns.isEmpty()) {
            String pk = dialect.getPrimaryKeyDefinitionSql(pkColumns, columns);
            if (!pk.isEmpty()) {
                sb.append("  ").append(pk).append(",\n");
            }
        }
    }
}
