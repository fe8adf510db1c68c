package org.keel.migration;

import lombok.Getter;
import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.SqlContributor;
import org.keel.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Statements against one existing table, rendered in contributor priority order whatever
 * order they were added in.
 */
public class TableStatementBuilder {
    @Getter
    private final String tableName;
    private final DdlDialect dialect;
    private final List<DdlContributor> contributors = new ArrayList<>();

    public TableStatementBuilder(String tableName, DdlDialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public TableStatementBuilder add(DdlContributor contributor) {
        contributors.add(contributor);
        return this;
    }

    public boolean isEmpty() {
        return contributors.isEmpty();
    }

    public String build() {
        StringBuilder sb = new StringBuilder();
        contributors.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));
        return sb.toString();
    }
}
