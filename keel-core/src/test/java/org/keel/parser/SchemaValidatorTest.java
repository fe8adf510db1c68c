package org.keel.parser;

import org.keel.exception.SchemaValidationException;
import org.keel.parser.ast.Schema;
import org.keel.testing.Declarations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

class SchemaValidatorTest {

    private SchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
    }

    private List<String> messages(String text) {
        return validator.validate(SchemaParser.parseOrThrow(text)).stream().map(ValidationError::message).toList();
    }

    @Test
    @DisplayName("A complete declaration has no errors")
    void validate_blog() {
        assertThat(messages(Declarations.blog("postgresql"))).isEmpty();
        assertThat(messages(Declarations.blog("sqlite"))).isEmpty();
    }

    @Test
    @DisplayName("validateOrThrow returns the schema when valid")
    void validateOrThrow_returnsSchema() {
        Schema schema = SchemaParser.parseOrThrow(Declarations.blog("mysql"));

        assertSame(schema, validator.validateOrThrow(schema));
    }

    @Test
    @DisplayName("A datasource block is required")
    void validate_missingDatasource() {
        assertThat(messages("model A {\n  id Int @id\n}\n")).containsExactly("a datasource block is required");
    }

    @Test
    @DisplayName("Only the three providers are accepted")
    void validate_unknownProvider() {
        assertThat(messages(Declarations.datasource("oracle")))
                .singleElement().asString()
                .startsWith("datasource provider \"oracle\" is not supported");
    }

    @Test
    @DisplayName("Every model needs a unique criterion")
    void validate_noUniqueCriterion() {
        String text = Declarations.datasource("sqlite") + "model Log {\n  message String\n}\n";

        assertThat(messages(text)).containsExactly(
                "model 'Log' needs a unique criterion (@id, @@id, @unique or @@unique)");
    }

    @Test
    @DisplayName("A compound @@id is a unique criterion; @@ignore models are exempt")
    void validate_compoundIdAndIgnore() {
        String text = Declarations.datasource("sqlite") + """
                model Membership {
                  userId  Int
                  groupId Int

                  @@id([userId, groupId])
                }

                model Legacy {
                  data String

                  @@ignore
                }
                """;

        assertThat(messages(text)).isEmpty();
    }

    @Test
    @DisplayName("Duplicate fields and unknown types are reported")
    void validate_fieldErrors() {
        String text = Declarations.datasource("postgresql") + """
                model A {
                  id   Int     @id
                  id   String
                  tag  Strin
                }
                """;

        assertThat(messages(text)).containsExactlyInAnyOrder(
                "duplicate field 'id' in model 'A'",
                "type 'Strin' of field 'A.tag' is neither a built-in scalar nor a declared model or enum");
    }

    @Test
    @DisplayName("Scalar lists are PostgreSQL only")
    void validate_scalarLists() {
        String model = """
                model A {
                  id   Int      @id
                  tags String[]
                }
                """;

        assertThat(messages(Declarations.datasource("postgresql") + model)).isEmpty();
        assertThat(messages(Declarations.datasource("mysql") + model))
                .containsExactly("scalar list field 'A.tags' is only supported on postgresql");
    }

    @Test
    @DisplayName("Enum defaults must name a declared value")
    void validate_enumDefault() {
        String text = Declarations.datasource("postgresql") + """
                enum Role {
                  USER
                  ADMIN
                }

                model A {
                  id   Int  @id
                  role Role @default(OWNER)
                }
                """;

        assertThat(messages(text)).containsExactly("default value 'OWNER' is not a value of enum 'Role'");
    }

    @Test
    @DisplayName("Relations need both fields and references and known actions")
    void validate_relations() {
        String text = Declarations.datasource("postgresql") + """
                model User {
                  id    Int    @id
                  posts Post[]
                }

                model Post {
                  id       Int  @id
                  authorId Int
                  author   User @relation(fields: [authorId], onDelete: Explode)
                }
                """;

        assertThat(messages(text)).contains("@relation on 'Post.author' needs both fields and references");

        String actions = text.replace("@relation(fields: [authorId], onDelete: Explode)",
                "@relation(fields: [authorId], references: [id], onDelete: Explode)");
        assertThat(messages(actions)).containsExactly("unknown referential action 'Explode' for onDelete on 'Post.author'");
    }

    @Test
    @DisplayName("Empty enums and double primary keys are rejected")
    void validate_enumAndPrimaryKey() {
        String text = Declarations.datasource("sqlite") + """
                enum Empty {
                }

                model A {
                  a Int @id
                  b Int

                  @@id([a, b])
                }
                """;

        assertThat(messages(text)).containsExactlyInAnyOrder(
                "enum 'Empty' has no values",
                "model 'A' declares more than one primary key");
    }

    @Test
    @DisplayName("validateOrThrow carries every error")
    void validateOrThrow_fails() {
        Schema schema = SchemaParser.parseOrThrow("model A {\n  x Int\n}\n");

        assertThatThrownBy(() -> validator.validateOrThrow(schema))
                .isInstanceOf(SchemaValidationException.class)
                .satisfies(e -> assertThat(((SchemaValidationException) e).getErrors()).hasSize(2));
    }
}
