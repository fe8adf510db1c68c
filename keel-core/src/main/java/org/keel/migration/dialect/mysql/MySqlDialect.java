package org.keel.migration.dialect.mysql;

import org.keel.migration.AbstractDialect;
import org.keel.migration.ColumnChangePolicy;
import org.keel.migration.DatabaseType;
import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.TypeMapper;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class MySqlDialect extends AbstractDialect {

    private static final Pattern FRACTIONAL_PRECISION = Pattern.compile("^(?:DATETIME|TIMESTAMP)\\((\\d+)\\)$");
    private static final Pattern CHARSET_LITERAL = Pattern.compile("^_\\w+\\\\?'(.*?)\\\\?'$", Pattern.DOTALL);
    private static final Pattern NO_LITERAL_DEFAULT =
            Pattern.compile("^(TINY|MEDIUM|LONG)?(TEXT|BLOB)$|^JSON$");

    private final ColumnChangePolicy policy = ColumnChangePolicy.alterInPlace();

    public MySqlDialect() {
        super();
    }

    // for tests
    public MySqlDialect(TypeMapper typeMapper, IntrospectionQueries introspectionQueries) {
        this.typeMapper = typeMapper;
        this.introspectionQueries = introspectionQueries;
    }

    @Override
    protected TypeMapper initializeTypeMapper() {
        return new MySqlTypeMapper();
    }

    @Override
    protected IntrospectionQueries initializeIntrospectionQueries() {
        return new MySqlIntrospectionQueries();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }

    @Override
    public ColumnChangePolicy columnChangePolicy() {
        return policy;
    }

    /**
     * DDL statements commit implicitly, so a failing migration can leave earlier statements applied.
     */
    @Override
    public boolean supportsTransactionalDdl() {
        return false;
    }

    @Override
    public boolean backslashEscapesInLiterals() {
        return true;
    }

    @Override
    public boolean requiresRedefinition(ChangeSet.AlteredTable table) {
        return false;
    }

    @Override
    public int getMaxIdentifierLength() {
        return 64; // MySQL identifier limit
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    protected String quoteLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    @Override
    public String closeCreateTable() {
        return "\n) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_unicode_ci;";
    }

    // Column

    @Override
    protected String getIdentityClause(ColumnModel c) {
        return " AUTO_INCREMENT";
    }

    @Override
    public String getModifyColumnSql(String table, ChangeSet.ColumnChange change) {
        if (policy.strategyFor(change) == ColumnChangePolicy.Strategy.DROP_AND_ADD) {
            return getDropColumnSql(table, change.getOldColumn()) + getAddColumnSql(table, change.getNewColumn());
        }
        return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN "
                + getColumnDefinitionSql(change.getNewColumn()) + ";\n";
    }

    // Primary key

    /**
     * An {@code AUTO_INCREMENT} column must stay indexed, so surviving key columns lose the
     * attribute before the key is dropped.
     */
    @Override
    public String getDropPrimaryKeySql(ChangeSet.AlteredTable table) {
        StringBuilder sb = new StringBuilder();
        TableModel oldTable = table.getOldTable();
        TableModel newTable = table.getNewTable();
        for (String pk : table.getPrimaryKeyChange().getOldColumns()) {
            ColumnModel col = oldTable == null ? null : oldTable.findColumn(pk).orElse(null);
            if (col == null || !col.isAutoIncrement()) {
                continue;
            }
            if (newTable != null && newTable.findColumn(pk).isEmpty()) {
                // dropped with the table alteration
                continue;
            }
            ColumnModel plain = col.toBuilder().defaultValue(null).build();
            sb.append("ALTER TABLE ").append(quoteIdentifier(table.getTableName()))
                    .append(" MODIFY COLUMN ").append(getColumnDefinitionSql(plain)).append(";\n");
        }
        return sb.append("ALTER TABLE ").append(quoteIdentifier(table.getTableName()))
                .append(" DROP PRIMARY KEY;\n").toString();
    }

    // Indexes

    @Override
    public String getDropIndexSql(String table, IndexModel index) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP INDEX " + quoteIdentifier(index.getIndexName()) + ";\n";
    }

    // Foreign keys

    @Override
    public String getDropForeignKeySql(String table, ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP FOREIGN KEY " + quoteIdentifier(fk.getConstraintName()) + ";\n";
    }

    // Defaults

    /**
     * Text, blob and JSON columns only take expression defaults, so literals are wrapped.
     */
    @Override
    public String renderDefault(ColumnModel column) {
        String rendered = super.renderDefault(column);
        if (rendered == null) {
            return null;
        }
        if (DefaultValues.dbGeneratedSql(column.getDefaultValue()).isPresent()) {
            return "(" + DefaultValues.canonicalSql(rendered) + ")";
        }
        String type = column.getSqlType().toUpperCase(Locale.ROOT);
        if (NO_LITERAL_DEFAULT.matcher(type).matches() && !rendered.startsWith("(")) {
            return "(" + rendered + ")";
        }
        return rendered;
    }

    @Override
    protected String nowExpression(ColumnModel column) {
        Matcher m = FRACTIONAL_PRECISION.matcher(column.getSqlType().toUpperCase(Locale.ROOT));
        return m.matches() ? "CURRENT_TIMESTAMP(" + m.group(1) + ")" : "CURRENT_TIMESTAMP";
    }

    @Override
    protected String uuidExpression() {
        return "(uuid())";
    }

    /**
     * Literal defaults arrive unquoted; expression defaults are flagged {@code DEFAULT_GENERATED}.
     */
    @Override
    protected String normalizeDefaultExpression(String expr, String canonicalType, boolean expression) {
        if (!expression) {
            return literalFor(unquoteLiteral(expr).orElse(expr), canonicalType);
        }
        String e = stripParentheses(expr);
        if (isCurrentTimestamp(e)) {
            return DefaultValues.NOW;
        }
        if (e.equalsIgnoreCase("uuid()")) {
            return DefaultValues.UUID;
        }
        Matcher charset = CHARSET_LITERAL.matcher(e);
        if (charset.matches()) {
            return literalFor(charset.group(1).replace("\\'", "'"), canonicalType);
        }
        Optional<String> literal = unquoteLiteral(e);
        if (literal.isPresent()) {
            return literalFor(literal.get(), canonicalType);
        }
        return DefaultValues.dbGenerated(e);
    }
}
