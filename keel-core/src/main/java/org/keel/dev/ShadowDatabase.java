package org.keel.dev;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.KeelException;
import org.keel.exception.MigrationApplyException;
import org.keel.history.Migration;
import org.keel.history.SqlStatementSplitter;
import org.keel.introspect.ConnectionFactory;
import org.keel.introspect.SchemaIntrospector;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.SchemaModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * A scratch database used to compute the schema a list of migrations produces. It is wiped
 * before and after each replay.
 */
@Slf4j
public class ShadowDatabase {
    private final String url;
    private final DdlDialect dialect;
    private final ConnectionFactory connections;
    private final SchemaIntrospector introspector;

    public ShadowDatabase(String url, DdlDialect dialect, ConnectionFactory connections, SchemaIntrospector introspector) {
        this.url = url;
        this.dialect = dialect;
        this.connections = connections;
        this.introspector = introspector;
    }

    public SchemaModel replay(List<Migration> migrations) {
        try (Connection connection = connections.open(url)) {
            SchemaCleaner cleaner = new SchemaCleaner(dialect, introspector);
            cleaner.dropAll(connection);
            try (Statement st = connection.createStatement()) {
                for (Migration m : migrations) {
                    for (String statement : SqlStatementSplitter.split(m.sql(), dialect.backslashEscapesInLiterals())) {
                        try {
                            st.execute(statement);
                        } catch (SQLException e) {
                            throw new MigrationApplyException(m.name(), statement, e);
                        }
                    }
                }
            }
            SchemaModel expected = introspector.introspect(connection, dialect);
            cleaner.dropAll(connection);
            log.debug("Replayed {} migration(s) in the shadow database", migrations.size());
            return expected;
        } catch (SQLException e) {
            throw new KeelException("Shadow database failed: " + e.getMessage(), e);
        }
    }
}
