package org.keel.migration;

import org.keel.migration.dialect.mysql.MySqlDialect;
import org.keel.migration.dialect.postgresql.PostgreSqlDialect;
import org.keel.migration.dialect.sqlite.SqliteDialect;
import org.keel.migration.spi.dialect.DdlDialect;

public final class Dialects {

    private Dialects() {
    }

    public static DdlDialect forType(DatabaseType type) {
        return switch (type) {
            case POSTGRESQL -> new PostgreSqlDialect();
            case MYSQL -> new MySqlDialect();
            case SQLITE -> new SqliteDialect();
        };
    }

    public static DdlDialect forProvider(String provider) {
        return forType(DatabaseType.fromProvider(provider));
    }
}
