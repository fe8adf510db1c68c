package org.keel.migration.dialect.postgresql;

import org.keel.mapping.SchemaModelMapper;
import org.keel.migration.spi.IntrospectionQueries.ColumnRow;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;
import org.keel.parser.SchemaParser;
import org.keel.testing.Declarations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PostgreSqlDialectTest {

    private PostgreSqlDialect dialect;

    @BeforeEach
    void setUp() {
        dialect = new PostgreSqlDialect();
    }

    private static ColumnModel column(String name, String type, boolean nullable, String defaultValue) {
        return ColumnModel.builder().columnName(name).sqlType(type).isNullable(nullable).defaultValue(defaultValue).build();
    }

    private static ChangeSet.ColumnChange change(ColumnModel from, ColumnModel to, ChangeSet.ColumnChange.Aspect... aspects) {
        EnumSet<ChangeSet.ColumnChange.Aspect> set = EnumSet.noneOf(ChangeSet.ColumnChange.Aspect.class);
        set.addAll(List.of(aspects));
        return ChangeSet.ColumnChange.builder().oldColumn(from).newColumn(to).aspects(set).build();
    }

    @Nested
    @DisplayName("CREATE TABLE")
    class CreateTable {

        @Test
        @DisplayName("Serial key, inline UNIQUE, defaults and primary key")
        void createTable_user() {
            TableModel user = new SchemaModelMapper(dialect)
                    .map(SchemaParser.parseOrThrow(Declarations.blog("postgresql")))
                    .findTable("User").orElseThrow();

            String sql = dialect.getCreateTableSql(user, true);

            assertThat(sql).startsWith("CREATE TABLE \"User\" (\n");
            assertThat(sql).contains(
                    "  \"id\" SERIAL NOT NULL,\n",
                    "  \"email\" TEXT NOT NULL UNIQUE,\n",
                    "  \"name\" TEXT,\n",
                    "  \"active\" BOOLEAN NOT NULL DEFAULT true,\n",
                    "  \"createdAt\" TIMESTAMP(3) NOT NULL DEFAULT CURRENT_TIMESTAMP,\n",
                    "  PRIMARY KEY (\"id\")\n);");
            assertThat(sql).doesNotContain("CREATE UNIQUE INDEX");
        }

        @Test
        @DisplayName("Foreign keys are inlined and plain indexes follow the table")
        void createTable_post() {
            TableModel post = new SchemaModelMapper(dialect)
                    .map(SchemaParser.parseOrThrow(Declarations.blog("postgresql")))
                    .findTable("Post").orElseThrow();

            String sql = dialect.getCreateTableSql(post, true);

            assertThat(sql).contains("CONSTRAINT \"Post_authorId_fkey\" FOREIGN KEY (\"authorId\") REFERENCES \"User\"(\"id\")"
                    + " ON DELETE RESTRICT ON UPDATE CASCADE");
            assertThat(sql).endsWith("CREATE INDEX \"Post_title_idx\" ON \"Post\"(\"title\");\n");
        }

        @Test
        @DisplayName("BIGINT autoincrement becomes BIGSERIAL")
        void columnDefinition_bigserial() {
            assertEquals("\"id\" BIGSERIAL NOT NULL",
                    dialect.getColumnDefinitionSql(column("id", "BIGINT", false, "autoincrement()")));
        }
    }

    @Nested
    @DisplayName("Column changes")
    class ColumnChanges {

        @Test
        @DisplayName("Compatible type change is cast in place")
        void modify_typeInPlace() {
            ColumnModel from = column("views", "INTEGER", false, null);
            ColumnModel to = column("views", "BIGINT", false, null);

            String sql = dialect.getModifyColumnSql("Post", change(from, to, ChangeSet.ColumnChange.Aspect.TYPE));

            assertEquals("ALTER TABLE \"Post\" ALTER COLUMN \"views\" SET DATA TYPE BIGINT USING \"views\"::BIGINT;\n", sql);
        }

        @Test
        @DisplayName("Incompatible type change drops and re-adds the column")
        void modify_dropAndAdd() {
            ColumnModel from = column("flag", "TEXT", true, null);
            ColumnModel to = column("flag", "BOOLEAN", true, null);

            String sql = dialect.getModifyColumnSql("T", change(from, to, ChangeSet.ColumnChange.Aspect.TYPE));

            assertEquals("ALTER TABLE \"T\" DROP COLUMN \"flag\";\nALTER TABLE \"T\" ADD COLUMN \"flag\" BOOLEAN;\n", sql);
        }

        @Test
        @DisplayName("Nullability and default changes")
        void modify_nullabilityAndDefault() {
            ColumnModel from = column("name", "TEXT", true, null);
            ColumnModel to = column("name", "TEXT", false, "\"anon\"");

            String sql = dialect.getModifyColumnSql("User", change(from, to,
                    ChangeSet.ColumnChange.Aspect.NULLABILITY, ChangeSet.ColumnChange.Aspect.DEFAULT));

            assertThat(sql).contains(
                    "ALTER TABLE \"User\" ALTER COLUMN \"name\" SET NOT NULL;\n",
                    "ALTER TABLE \"User\" ALTER COLUMN \"name\" SET DEFAULT 'anon';\n");
        }

        @Test
        @DisplayName("Removing a default drops it")
        void modify_dropDefault() {
            ColumnModel from = column("views", "INTEGER", false, "0");
            ColumnModel to = column("views", "INTEGER", false, null);

            String sql = dialect.getModifyColumnSql("Post", change(from, to, ChangeSet.ColumnChange.Aspect.DEFAULT));

            assertEquals("ALTER TABLE \"Post\" ALTER COLUMN \"views\" DROP DEFAULT;\n", sql);
        }
    }

    @Nested
    @DisplayName("Keys and indexes")
    class KeysAndIndexes {

        @Test
        @DisplayName("Primary key is dropped by its constraint name")
        void dropPrimaryKey() {
            ChangeSet.AlteredTable altered = ChangeSet.AlteredTable.builder()
                    .tableName("T")
                    .primaryKeyChange(ChangeSet.PrimaryKeyChange.builder().oldColumns(List.of("a")).build())
                    .build();

            assertEquals("ALTER TABLE \"T\" DROP CONSTRAINT \"T_pkey\";\n", dialect.getDropPrimaryKeySql(altered));
        }

        @Test
        @DisplayName("Constraint-backed unique indexes are dropped as constraints")
        void dropIndex() {
            IndexModel plain = IndexModel.of("T_a_idx", false, "a");
            IndexModel constraint = IndexModel.builder().indexName("T_a_key").isUnique(true).constraintBacked(true).build();

            assertEquals("DROP INDEX \"T_a_idx\";\n", dialect.getDropIndexSql("T", plain));
            assertEquals("ALTER TABLE \"T\" DROP CONSTRAINT \"T_a_key\";\n", dialect.getDropIndexSql("T", constraint));
        }

        @Test
        @DisplayName("Foreign keys are added and dropped by name")
        void foreignKeys() {
            ForeignKeyModel fk = ForeignKeyModel.builder()
                    .constraintName("Post_authorId_fkey")
                    .columns(List.of("authorId"))
                    .referencedTable("User")
                    .referencedColumns(List.of("id"))
                    .build();

            assertEquals("ALTER TABLE \"Post\" ADD CONSTRAINT \"Post_authorId_fkey\" FOREIGN KEY (\"authorId\")"
                    + " REFERENCES \"User\"(\"id\") ON DELETE RESTRICT ON UPDATE CASCADE;\n", dialect.getAddForeignKeySql("Post", fk));
            assertEquals("ALTER TABLE \"Post\" DROP CONSTRAINT \"Post_authorId_fkey\";\n", dialect.getDropForeignKeySql("Post", fk));
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Canonical defaults render as PostgreSQL expressions")
        void renderDefault() {
            assertEquals("gen_random_uuid()", dialect.renderDefault(column("id", "UUID", false, "uuid()")));
            assertEquals("'it''s'", dialect.renderDefault(column("s", "TEXT", false, "\"it's\"")));
            assertEquals("lower('X')", dialect.renderDefault(column("s", "TEXT", false, "dbgenerated(\"lower('X')\")")));
            assertNull(dialect.renderDefault(column("s", "TEXT", false, "cuid()")));
        }

        @Test
        @DisplayName("Catalog defaults normalize to the canonical form")
        void normalizeDefault() {
            assertEquals("\"draft\"", dialect.normalizeDefault(
                    new ColumnRow("status", "text", false, "'draft'::text", false, false), "TEXT"));
            assertEquals("now()", dialect.normalizeDefault(
                    new ColumnRow("at", "timestamp(3) without time zone", false, "CURRENT_TIMESTAMP", false, true), "TIMESTAMP(3)"));
            assertEquals("autoincrement()", dialect.normalizeDefault(
                    new ColumnRow("id", "integer", false, "nextval('\"User_id_seq\"'::regclass)", true, true), "INTEGER"));
            assertEquals("0", dialect.normalizeDefault(
                    new ColumnRow("views", "integer", false, "0", false, false), "INTEGER"));
            assertEquals("uuid()", dialect.normalizeDefault(
                    new ColumnRow("id", "uuid", false, "gen_random_uuid()", false, true), "UUID"));
            assertNull(dialect.normalizeDefault(new ColumnRow("x", "text", true, null, false, false), "TEXT"));
        }
    }

    @Test
    @DisplayName("Catalog type spellings are folded")
    void typeMapper_normalize() {
        PostgreSqlTypeMapper mapper = new PostgreSqlTypeMapper();

        assertEquals("VARCHAR(32)", mapper.normalize("character varying(32)"));
        assertEquals("TIMESTAMP(3)", mapper.normalize("timestamp(3) without time zone"));
        assertEquals("TIMESTAMPTZ(6)", mapper.normalize("timestamp(6) with time zone"));
        assertEquals("DECIMAL(65,30)", mapper.normalize("numeric(65,30)"));
        assertEquals("TEXT[]", mapper.normalize("text[]"));
        assertEquals("DOUBLE PRECISION", mapper.normalize("double precision"));
    }
}
