package org.keel.mapping;

import org.keel.exception.SchemaValidationException;
import org.keel.migration.dialect.mysql.MySqlDialect;
import org.keel.migration.dialect.postgresql.PostgreSqlDialect;
import org.keel.migration.dialect.sqlite.SqliteDialect;
import org.keel.migration.spi.dialect.Dialect;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexColumn;
import org.keel.model.IndexModel;
import org.keel.model.ReferentialAction;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;
import org.keel.parser.SchemaParser;
import org.keel.testing.Declarations;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaModelMapperTest {

    private static SchemaModel map(Dialect dialect, String text) {
        return new SchemaModelMapper(dialect).map(SchemaParser.parseOrThrow(text));
    }

    @Test
    @DisplayName("Models become tables; relation fields are not columns")
    void map_blogOnPostgres() {
        SchemaModel model = map(new PostgreSqlDialect(), Declarations.blog("postgresql"));

        assertThat(model.getTables()).containsOnlyKeys("User", "Post");
        TableModel user = model.findTable("User").orElseThrow();
        assertThat(user.getColumns()).containsOnlyKeys("id", "email", "name", "active", "createdAt");
        assertThat(user.getPrimaryKey()).containsExactly("id");

        ColumnModel id = user.findColumn("id").orElseThrow();
        assertEquals("INTEGER", id.getSqlType());
        assertTrue(id.isPrimaryKey());
        assertFalse(id.isNullable());
        assertEquals("autoincrement()", id.getDefaultValue());

        assertTrue(user.findColumn("name").orElseThrow().isNullable());
        assertEquals("TIMESTAMP(3)", user.findColumn("createdAt").orElseThrow().getSqlType());
        assertEquals("now()", user.findColumn("createdAt").orElseThrow().getDefaultValue());
        assertEquals("true", user.findColumn("active").orElseThrow().getDefaultValue());
    }

    @Test
    @DisplayName("@unique becomes a named unique index and marks the column")
    void map_uniqueField() {
        TableModel user = map(new PostgreSqlDialect(), Declarations.blog("postgresql")).findTable("User").orElseThrow();

        assertTrue(user.findColumn("email").orElseThrow().isUnique());
        assertThat(user.getIndexes()).singleElement().satisfies(idx -> {
            assertEquals("User_email_key", idx.getIndexName());
            assertTrue(idx.isUnique());
            assertThat(idx.getColumnNames()).containsExactly("email");
        });
    }

    @Test
    @DisplayName("Relations become foreign keys with default actions")
    void map_foreignKeys() {
        TableModel post = map(new SqliteDialect(), Declarations.blog("sqlite")).findTable("Post").orElseThrow();

        assertThat(post.getIndexes()).extracting(IndexModel::getIndexName).containsExactly("Post_title_idx");
        ForeignKeyModel fk = post.getForeignKeys().get(0);
        assertEquals("Post_authorId_fkey", fk.getConstraintName());
        assertThat(fk.getColumns()).containsExactly("authorId");
        assertEquals("User", fk.getReferencedTable());
        assertThat(fk.getReferencedColumns()).containsExactly("id");
        assertEquals(ReferentialAction.RESTRICT, fk.getOnDelete());
        assertEquals(ReferentialAction.CASCADE, fk.getOnUpdate());
    }

    @Test
    @DisplayName("Optional relations default to SET NULL; declared actions win")
    void map_referentialActions() {
        String text = Declarations.datasource("postgresql") + """
                model User {
                  id    Int    @id
                  posts Post[]
                  notes Note[]
                }

                model Post {
                  id       Int   @id
                  authorId Int?
                  author   User? @relation(fields: [authorId], references: [id])
                }

                model Note {
                  id      Int  @id
                  ownerId Int
                  owner   User @relation(fields: [ownerId], references: [id], onDelete: Cascade, onUpdate: NoAction)
                }
                """;

        SchemaModel model = map(new PostgreSqlDialect(), text);

        assertEquals(ReferentialAction.SET_NULL, model.findTable("Post").orElseThrow().getForeignKeys().get(0).getOnDelete());
        ForeignKeyModel note = model.findTable("Note").orElseThrow().getForeignKeys().get(0);
        assertEquals(ReferentialAction.CASCADE, note.getOnDelete());
        assertEquals(ReferentialAction.NO_ACTION, note.getOnUpdate());
    }

    @Test
    @DisplayName("@map and @@map rename tables and columns")
    void map_physicalNames() {
        String text = Declarations.datasource("postgresql") + """
                model User {
                  id        Int    @id
                  firstName String @map("first_name")

                  @@map("users")
                  @@index([firstName], map: "users_first_name")
                }
                """;

        TableModel users = map(new PostgreSqlDialect(), text).findTable("users").orElseThrow();

        assertThat(users.getColumns()).containsOnlyKeys("id", "first_name");
        assertThat(users.getIndexes()).singleElement().satisfies(idx -> {
            assertEquals("users_first_name", idx.getIndexName());
            assertThat(idx.getColumnNames()).containsExactly("first_name");
        });
    }

    @Test
    @DisplayName("Compound keys, sort orders and unique constraints")
    void map_blockAttributes() {
        String text = Declarations.datasource("postgresql") + """
                model Membership {
                  userId  Int
                  groupId Int
                  joined  DateTime

                  @@id([userId, groupId])
                  @@unique([groupId, joined])
                  @@index([joined(sort: Desc)])
                }
                """;

        TableModel table = map(new PostgreSqlDialect(), text).findTable("Membership").orElseThrow();

        assertThat(table.getPrimaryKey()).containsExactly("userId", "groupId");
        assertFalse(table.findColumn("userId").orElseThrow().isNullable());
        IndexModel unique = table.getIndexes().get(0);
        assertEquals("Membership_groupId_joined_key", unique.getIndexName());
        assertTrue(unique.isUnique());
        IndexColumn joined = table.getIndexes().get(1).getColumns().get(0);
        assertEquals(IndexColumn.SortOrder.DESC, joined.getSortOrder());
    }

    @Test
    @DisplayName("Scalar types map through the provider's type table")
    void map_typesPerProvider() {
        String model = """
                model T {
                  id    BigInt  @id
                  price Decimal
                  ok    Boolean
                  at    DateTime
                  data  Json
                  raw   Bytes
                  ratio Float
                }
                """;

        TableModel mysql = map(new MySqlDialect(), Declarations.datasource("mysql") + model).findTable("T").orElseThrow();
        assertEquals("BIGINT", mysql.findColumn("id").orElseThrow().getSqlType());
        assertEquals("DECIMAL(65,30)", mysql.findColumn("price").orElseThrow().getSqlType());
        assertEquals("TINYINT(1)", mysql.findColumn("ok").orElseThrow().getSqlType());
        assertEquals("DATETIME(3)", mysql.findColumn("at").orElseThrow().getSqlType());
        assertEquals("JSON", mysql.findColumn("data").orElseThrow().getSqlType());
        assertEquals("LONGBLOB", mysql.findColumn("raw").orElseThrow().getSqlType());
        assertEquals("DOUBLE", mysql.findColumn("ratio").orElseThrow().getSqlType());

        TableModel sqlite = map(new SqliteDialect(), Declarations.datasource("sqlite") + model).findTable("T").orElseThrow();
        assertEquals("INTEGER", sqlite.findColumn("id").orElseThrow().getSqlType());
        assertEquals("REAL", sqlite.findColumn("ratio").orElseThrow().getSqlType());
        assertEquals("TEXT", sqlite.findColumn("data").orElseThrow().getSqlType());
        assertEquals("BLOB", sqlite.findColumn("raw").orElseThrow().getSqlType());
    }

    @Test
    @DisplayName("Native types, enums and lists")
    void map_nativeTypesEnumsLists() {
        String text = Declarations.datasource("postgresql") + """
                enum Role {
                  USER
                  ADMIN
                }

                model Account {
                  id   String   @id @default(uuid()) @db.Uuid
                  code String   @db.VarChar(32)
                  role Role     @default(USER)
                  tags String[]
                  ref  String   @default(cuid())
                }
                """;

        TableModel account = map(new PostgreSqlDialect(), text).findTable("Account").orElseThrow();

        assertEquals("UUID", account.findColumn("id").orElseThrow().getSqlType());
        assertEquals("uuid()", account.findColumn("id").orElseThrow().getDefaultValue());
        assertEquals("VARCHAR(32)", account.findColumn("code").orElseThrow().getSqlType());
        assertEquals("TEXT", account.findColumn("role").orElseThrow().getSqlType());
        assertEquals("\"USER\"", account.findColumn("role").orElseThrow().getDefaultValue());
        assertEquals("TEXT[]", account.findColumn("tags").orElseThrow().getSqlType());
        assertEquals("cuid()", account.findColumn("ref").orElseThrow().getDefaultValue());
    }

    @Test
    @DisplayName("dbgenerated defaults keep their SQL")
    void map_dbGenerated() {
        String text = Declarations.datasource("postgresql") + """
                model A {
                  id    Int    @id
                  slug  String @default(dbgenerated("lower('X')"))
                  score Float  @default(1.50)
                }
                """;

        TableModel a = map(new PostgreSqlDialect(), text).findTable("A").orElseThrow();

        assertEquals("dbgenerated(\"lower('X')\")", a.findColumn("slug").orElseThrow().getDefaultValue());
        assertEquals("1.5", a.findColumn("score").orElseThrow().getDefaultValue());
        assertNull(a.findColumn("id").orElseThrow().getDefaultValue());
    }

    @Test
    @DisplayName("Ignored models and fields are left out")
    void map_ignored() {
        String text = Declarations.datasource("sqlite") + """
                model A {
                  id     Int    @id
                  legacy String @ignore
                }

                model Old {
                  id Int @id

                  @@ignore
                }
                """;

        SchemaModel model = map(new SqliteDialect(), text);

        assertThat(model.getTables()).containsOnlyKeys("A");
        assertThat(model.findTable("A").orElseThrow().getColumns()).containsOnlyKeys("id");
    }

    @Test
    @DisplayName("Scalar lists fail on providers without list columns")
    void map_listOnMySql() {
        String text = Declarations.datasource("mysql") + "model A {\n  id Int @id\n  tags String[]\n}\n";

        assertThatThrownBy(() -> map(new MySqlDialect(), text))
                .isInstanceOf(SchemaValidationException.class)
                .hasMessageContaining("scalar list field 'A.tags' is not supported by mysql");
    }
}
