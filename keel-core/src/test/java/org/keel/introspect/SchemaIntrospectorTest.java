package org.keel.introspect;

import org.keel.history.MigrationLedger;
import org.keel.history.SqlStatementSplitter;
import org.keel.mapping.SchemaModelMapper;
import org.keel.migration.MigrationGenerator;
import org.keel.migration.dialect.sqlite.SqliteDialect;
import org.keel.migration.differs.SchemaDiffer;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.ReferentialAction;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;
import org.keel.parser.SchemaParser;
import org.keel.testing.Declarations;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaIntrospectorTest {

    private final SqliteDialect dialect = new SqliteDialect();
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:sqlite::memory:");
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    private void execute(String sql) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String statement : SqlStatementSplitter.split(sql)) {
                st.execute(statement);
            }
        }
    }

    @Test
    @DisplayName("A database built from declarations reads back without differences")
    void roundTrip() throws SQLException {
        SchemaModel declared = new SchemaModelMapper(dialect).map(SchemaParser.parseOrThrow(Declarations.blog("sqlite")));
        execute(new MigrationGenerator(dialect).generateSql(new SchemaDiffer(dialect).diff(SchemaModel.empty(), declared)));

        SchemaModel live = new SchemaIntrospector().introspect(connection, dialect);
        ChangeSet diff = new SchemaDiffer(dialect).diff(live, declared);

        assertTrue(diff.isEmpty(), () -> new MigrationGenerator(dialect).generateSql(diff));
    }

    @Test
    @DisplayName("Columns, keys, indexes and foreign keys are read into the canonical model")
    void readsStructure() throws SQLException {
        execute("""
                CREATE TABLE "Team" ("id" INTEGER NOT NULL PRIMARY KEY AUTOINCREMENT, "slug" TEXT NOT NULL UNIQUE);
                CREATE TABLE "Member" (
                  "teamId" INTEGER NOT NULL,
                  "userId" INTEGER NOT NULL,
                  "role" TEXT NOT NULL DEFAULT 'member',
                  "joinedAt" DATETIME DEFAULT CURRENT_TIMESTAMP,
                  PRIMARY KEY ("teamId", "userId"),
                  FOREIGN KEY ("teamId") REFERENCES "Team"("id") ON DELETE CASCADE ON UPDATE CASCADE
                );
                CREATE INDEX "Member_role_idx" ON "Member"("role" DESC);
                """);

        SchemaModel live = new SchemaIntrospector().introspect(connection, dialect);

        TableModel team = live.findTable("Team").orElseThrow();
        assertEquals("autoincrement()", team.findColumn("id").orElseThrow().getDefaultValue());
        assertTrue(team.findColumn("slug").orElseThrow().isUnique());

        TableModel member = live.findTable("Member").orElseThrow();
        assertThat(member.getPrimaryKey()).containsExactly("teamId", "userId");
        ColumnModel role = member.findColumn("role").orElseThrow();
        assertEquals("\"member\"", role.getDefaultValue());
        assertEquals("now()", member.findColumn("joinedAt").orElseThrow().getDefaultValue());
        assertTrue(member.findColumn("joinedAt").orElseThrow().isNullable());
        assertThat(member.getForeignKeys()).singleElement().satisfies(fk -> {
            assertEquals("Team", fk.getReferencedTable());
            assertEquals(ReferentialAction.CASCADE, fk.getOnDelete());
        });
        assertThat(member.getIndexes()).singleElement()
                .satisfies(idx -> assertThat(idx.getColumns().get(0).isPlain()).isFalse());
    }

    @Test
    @DisplayName("The ledger and SQLite internal tables are not part of the model")
    void skipsLedger() throws SQLException {
        new MigrationLedger(connection, dialect).ensureTable();
        execute("CREATE TABLE \"a\" (\"id\" INTEGER PRIMARY KEY AUTOINCREMENT);");

        SchemaModel live = new SchemaIntrospector().introspect(connection, dialect);

        assertThat(live.getTables().keySet()).containsExactly("a");
        assertThat(live.findTable(MigrationLedger.TABLE_NAME)).isEmpty();
    }
}
