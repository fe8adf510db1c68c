package org.keel.dev;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.KeelException;
import org.keel.history.MigrationLedger;
import org.keel.history.SqlStatementSplitter;
import org.keel.introspect.SchemaIntrospector;
import org.keel.migration.MigrationGenerator;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;

/**
 * Drops every table of a database, the ledger included.
 */
@Slf4j
public class SchemaCleaner {
    private final DdlDialect dialect;
    private final SchemaIntrospector introspector;

    public SchemaCleaner(DdlDialect dialect, SchemaIntrospector introspector) {
        this.dialect = dialect;
        this.introspector = introspector;
    }

    public void dropAll(Connection connection) {
        SchemaModel current = introspector.introspect(connection, dialect);
        ChangeSet drop = ChangeSet.builder()
                .droppedTables(new ArrayList<>(current.getTables().values()))
                .build();
        String sql = new MigrationGenerator(dialect).generateSql(drop);
        try (Statement st = connection.createStatement()) {
            for (String statement : SqlStatementSplitter.split(sql, dialect.backslashEscapesInLiterals())) {
                log.debug("Executing: {}", statement);
                st.execute(statement);
            }
            if (new MigrationLedger(connection, dialect).exists()) {
                st.execute(SqlStatementSplitter.split(dialect.getDropTableSql(MigrationLedger.TABLE_NAME)).get(0));
            }
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
        } catch (SQLException e) {
            throw new KeelException("Failed to drop existing tables: " + e.getMessage(), e);
        }
        log.debug("Dropped {} table(s)", current.getTables().size());
    }
}
