package org.keel.migration.dialect.postgresql;

import org.keel.migration.AbstractDialect;
import org.keel.migration.ColumnChangePolicy;
import org.keel.migration.DatabaseType;
import org.keel.migration.TypeFamily;
import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.TypeMapper;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PostgreSqlDialect extends AbstractDialect {

    private static final Pattern CAST_LITERAL = Pattern.compile("^('(?:[^']|'')*')::[\\w\\s\"\\[\\]().,]+$", Pattern.DOTALL);

    private final ColumnChangePolicy policy = ColumnChangePolicy.alterInPlace();

    public PostgreSqlDialect() {
        super();
    }

    // for tests
    public PostgreSqlDialect(TypeMapper typeMapper, IntrospectionQueries introspectionQueries) {
        this.typeMapper = typeMapper;
        this.introspectionQueries = introspectionQueries;
    }

    @Override
    protected TypeMapper initializeTypeMapper() {
        return new PostgreSqlTypeMapper();
    }

    @Override
    protected IntrospectionQueries initializeIntrospectionQueries() {
        return new PostgreSqlIntrospectionQueries();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    public ColumnChangePolicy columnChangePolicy() {
        return policy;
    }

    @Override
    public boolean supportsTransactionalDdl() {
        return true;
    }

    @Override
    public boolean requiresRedefinition(ChangeSet.AlteredTable table) {
        return false;
    }

    // Column

    /**
     * Autoincrement integers are declared through the serial pseudo-types.
     */
    @Override
    protected String columnType(ColumnModel c) {
        if (!c.isAutoIncrement()) {
            return c.getSqlType();
        }
        return switch (c.getSqlType().toUpperCase(Locale.ROOT)) {
            case "BIGINT" -> "BIGSERIAL";
            case "SMALLINT" -> "SMALLSERIAL";
            default -> "SERIAL";
        };
    }

    @Override
    public String getModifyColumnSql(String table, ChangeSet.ColumnChange change) {
        ColumnModel oldCol = change.getOldColumn();
        ColumnModel newCol = change.getNewColumn();
        String alter = "ALTER TABLE " + quoteIdentifier(table) + " ALTER COLUMN " + quoteIdentifier(newCol.getColumnName());

        if (policy.strategyFor(change) == ColumnChangePolicy.Strategy.DROP_AND_ADD) {
            return getDropColumnSql(table, oldCol) + getAddColumnSql(table, newCol);
        }

        StringBuilder sb = new StringBuilder();
        boolean typeChange = change.changes(ChangeSet.ColumnChange.Aspect.TYPE);
        boolean defaultChange = change.changes(ChangeSet.ColumnChange.Aspect.DEFAULT);

        // an old default may not cast to the new type
        if (typeChange && defaultChange && oldCol.getDefaultValue() != null) {
            sb.append(alter).append(" DROP DEFAULT;\n");
        }
        if (typeChange) {
            String type = newCol.getSqlType();
            sb.append(alter).append(" SET DATA TYPE ").append(type)
                    .append(" USING ").append(quoteIdentifier(newCol.getColumnName())).append("::").append(type).append(";\n");
        }
        if (change.changes(ChangeSet.ColumnChange.Aspect.NULLABILITY)) {
            sb.append(alter).append(newCol.isNullable() ? " DROP NOT NULL;\n" : " SET NOT NULL;\n");
        }
        if (defaultChange) {
            sb.append(defaultChangeSql(table, oldCol, newCol, alter, typeChange));
        }
        return sb.toString();
    }

    private String defaultChangeSql(String table, ColumnModel oldCol, ColumnModel newCol, String alter, boolean alreadyDropped) {
        StringBuilder sb = new StringBuilder();
        String sequence = table + "_" + newCol.getColumnName() + "_seq";
        if (newCol.isAutoIncrement()) {
            sb.append("CREATE SEQUENCE ").append(quoteIdentifier(sequence)).append(";\n")
                    .append(alter).append(" SET DEFAULT nextval('").append(quoteIdentifier(sequence)).append("');\n")
                    .append("ALTER SEQUENCE ").append(quoteIdentifier(sequence)).append(" OWNED BY ")
                    .append(quoteIdentifier(table)).append(".").append(quoteIdentifier(newCol.getColumnName())).append(";\n");
            return sb.toString();
        }
        String rendered = renderDefault(newCol);
        if (rendered != null) {
            sb.append(alter).append(" SET DEFAULT ").append(rendered).append(";\n");
        } else if (!alreadyDropped || oldCol.getDefaultValue() == null) {
            sb.append(alter).append(" DROP DEFAULT;\n");
        }
        if (oldCol.isAutoIncrement()) {
            sb.append("DROP SEQUENCE IF EXISTS ").append(quoteIdentifier(sequence)).append(";\n");
        }
        return sb.toString();
    }

    // Primary key

    @Override
    public String getDropPrimaryKeySql(ChangeSet.AlteredTable table) {
        String name = table.getPrimaryKeyChange().getOldConstraintName();
        if (name == null) {
            name = table.getTableName() + "_pkey";
        }
        return "ALTER TABLE " + quoteIdentifier(table.getTableName()) + " DROP CONSTRAINT " + quoteIdentifier(name) + ";\n";
    }

    // Indexes

    @Override
    public String getDropIndexSql(String table, IndexModel index) {
        if (index.isConstraintBacked()) {
            return "ALTER TABLE " + quoteIdentifier(table) + " DROP CONSTRAINT " + quoteIdentifier(index.getIndexName()) + ";\n";
        }
        return "DROP INDEX " + quoteIdentifier(index.getIndexName()) + ";\n";
    }

    // Foreign keys

    @Override
    public String getDropForeignKeySql(String table, ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP CONSTRAINT " + quoteIdentifier(fk.getConstraintName()) + ";\n";
    }

    // Defaults

    @Override
    protected String uuidExpression() {
        return "gen_random_uuid()";
    }

    @Override
    protected String normalizeDefaultExpression(String expr, String canonicalType, boolean expression) {
        Matcher cast = CAST_LITERAL.matcher(expr);
        String e = cast.matches() ? cast.group(1) : stripParentheses(expr);
        Optional<String> literal = unquoteLiteral(e);
        if (literal.isPresent()) {
            return literalFor(literal.get(), canonicalType);
        }
        if (isCurrentTimestamp(e)) {
            return DefaultValues.NOW;
        }
        if (e.equalsIgnoreCase("gen_random_uuid()")) {
            return DefaultValues.UUID;
        }
        if (e.equalsIgnoreCase("true") || e.equalsIgnoreCase("false")) {
            return e.toLowerCase(Locale.ROOT);
        }
        if (DefaultValues.isNumber(e) && TypeFamily.of(canonicalType) != TypeFamily.TEXT) {
            return DefaultValues.number(e);
        }
        return DefaultValues.dbGenerated(expr);
    }
}
