package org.keel.migration.contributor;

import org.keel.migration.spi.dialect.DdlDialect;

public interface DdlContributor extends SqlContributor {
    void contribute(StringBuilder sb, DdlDialect dialect);
}
