package org.keel.migration.contributor.create;

import org.keel.migration.contributor.DdlContributor;
import org.keel.migration.contributor.PostCreateContributor;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.IndexModel;

import java.util.List;

public record IndexContributor(String table, List<IndexModel> indexes) implements DdlContributor, PostCreateContributor {
    @Override
    public int priority() {
        return ADD_INDEX;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (IndexModel idx : indexes) {
            sb.append(dialect.indexStatement(idx, table));
        }
    }
}
