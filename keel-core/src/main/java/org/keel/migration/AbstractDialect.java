package org.keel.migration;

import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.TypeMapper;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexColumn;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared ANSI-style rendering. Providers override the statements their SQL differs on.
 */
public abstract class AbstractDialect implements DdlDialect {
    private static final Pattern QUOTED_LITERAL = Pattern.compile("^'((?:[^']|'')*)'$", Pattern.DOTALL);

    protected TypeMapper typeMapper;
    protected IntrospectionQueries introspectionQueries;

    protected AbstractDialect() {
        this.typeMapper = initializeTypeMapper();
        this.introspectionQueries = initializeIntrospectionQueries();
    }

    protected abstract TypeMapper initializeTypeMapper();
    protected abstract IntrospectionQueries initializeIntrospectionQueries();

    @Override
    public TypeMapper getTypeMapper() {
        return typeMapper;
    }

    @Override
    public IntrospectionQueries introspectionQueries() {
        return introspectionQueries;
    }

    @Override
    public CaseNormalizer identifierNormalizer() {
        return CaseNormalizer.preserve();
    }

    @Override
    public boolean isIndexColumnOrderSignificant() {
        return false;
    }

    @Override
    public int getMaxIdentifierLength() {
        return 63;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    protected String quoteColumns(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    protected String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    // Table

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n);";
    }

    @Override
    public String getCreateTableSql(TableModel table, boolean inlineForeignKeys) {
        return new CreateTableBuilder(table.getTableName(), this)
                .defaultsFrom(table, inlineForeignKeys)
                .build();
    }

    @Override
    public String getDropTableSql(String tableName) {
        return "DROP TABLE " + quoteIdentifier(tableName) + ";\n";
    }

    // Column

    @Override
    public String getColumnDefinitionSql(ColumnModel c) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(c.getColumnName())).append(" ").append(columnType(c));
        if (!c.isNullable()) {
            sb.append(" NOT NULL");
        }
        if (c.isAutoIncrement()) {
            sb.append(getIdentityClause(c));
        }
        String def = renderDefault(c);
        if (def != null) {
            sb.append(" DEFAULT ").append(def);
        }
        return sb.toString();
    }

    /**
     * Type token used in DDL; autoincrement columns may be spelled differently.
     */
    protected String columnType(ColumnModel c) {
        return c.getSqlType();
    }

    protected String getIdentityClause(ColumnModel c) {
        return "";
    }

    @Override
    public String getAddColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(column) + ";\n";
    }

    @Override
    public String getDropColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(column.getColumnName()) + ";\n";
    }

    // Primary Key

    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns, List<ColumnModel> columns) {
        return "PRIMARY KEY (" + quoteColumns(pkColumns) + ")";
    }

    @Override
    public String getAddPrimaryKeySql(String table, List<String> pkColumns) {
        if (pkColumns == null || pkColumns.isEmpty()) return "";
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD PRIMARY KEY (" + quoteColumns(pkColumns) + ");\n";
    }

    // Indexes

    @Override
    public String indexStatement(IndexModel idx, String table) {
        String cols = idx.getColumns().stream().map(this::indexColumnSql).collect(Collectors.joining(", "));
        return "CREATE " + (idx.isUnique() ? "UNIQUE " : "") + "INDEX " + quoteIdentifier(idx.getIndexName())
                + " ON " + quoteIdentifier(table) + "(" + cols + ");\n";
    }

    protected String indexColumnSql(IndexColumn col) {
        String ref = quoteIdentifier(col.getColumnName());
        if (col.getFunction() != null) {
            ref = col.getFunction() + "(" + ref + ")";
        }
        return col.getSortOrder() == IndexColumn.SortOrder.DESC ? ref + " DESC" : ref;
    }

    // Foreign keys

    @Override
    public String getForeignKeyDefinitionSql(ForeignKeyModel fk) {
        StringBuilder sb = new StringBuilder();
        if (fk.getConstraintName() != null) {
            sb.append("CONSTRAINT ").append(quoteIdentifier(fk.getConstraintName())).append(" ");
        }
        sb.append("FOREIGN KEY (").append(quoteColumns(fk.getColumns())).append(")")
                .append(" REFERENCES ").append(quoteIdentifier(fk.getReferencedTable()))
                .append("(").append(quoteColumns(fk.getReferencedColumns())).append(")")
                .append(" ON DELETE ").append(fk.getOnDelete().sql())
                .append(" ON UPDATE ").append(fk.getOnUpdate().sql());
        return sb.toString();
    }

    @Override
    public String getAddForeignKeySql(String table, ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD " + getForeignKeyDefinitionSql(fk) + ";\n";
    }

    @Override
    public boolean supportsForeignKeyAlteration() {
        return true;
    }

    // Defaults

    @Override
    public String renderDefault(ColumnModel column) {
        String expr = column.getDefaultValue();
        if (expr == null || DefaultValues.isAutoIncrement(expr) || DefaultValues.isClientGenerated(expr)) {
            return null;
        }
        if (DefaultValues.NOW.equals(expr)) {
            return nowExpression(column);
        }
        if (DefaultValues.UUID.equals(expr)) {
            return uuidExpression();
        }
        Optional<String> raw = DefaultValues.dbGeneratedSql(expr);
        if (raw.isPresent()) {
            return raw.get();
        }
        Optional<String> text = DefaultValues.stringValue(expr);
        if (text.isPresent()) {
            return quoteLiteral(text.get());
        }
        if (DefaultValues.isNumber(expr)) {
            return DefaultValues.number(expr);
        }
        return expr;
    }

    protected String nowExpression(ColumnModel column) {
        return "CURRENT_TIMESTAMP";
    }

    protected abstract String uuidExpression();

    @Override
    public String normalizeDefault(IntrospectionQueries.ColumnRow row, String canonicalType) {
        if (row.autoIncrement()) {
            return DefaultValues.AUTOINCREMENT;
        }
        String raw = row.rawDefault();
        if (raw == null) {
            return null;
        }
        String expr = raw.trim();
        if (expr.isEmpty() || expr.equalsIgnoreCase("NULL")) {
            return null;
        }
        return normalizeDefaultExpression(expr, canonicalType, row.expressionDefault());
    }

    protected abstract String normalizeDefaultExpression(String expr, String canonicalType, boolean expression);

    /**
     * Canonical literal for {@code text} given the column's type: numbers stay numbers on
     * numeric columns, 1/0 become booleans on boolean columns, anything else is a string.
     */
    protected String literalFor(String text, String canonicalType) {
        TypeFamily family = TypeFamily.of(canonicalType);
        switch (family) {
            case INTEGER, DECIMAL, FLOAT -> {
                if (DefaultValues.isNumber(text.trim())) {
                    return DefaultValues.number(text);
                }
            }
            case BOOLEAN -> {
                String b = text.trim().toLowerCase(Locale.ROOT);
                if (b.equals("1") || b.equals("true") || b.equals("t")) return "true";
                if (b.equals("0") || b.equals("false") || b.equals("f")) return "false";
            }
            default -> {
            }
        }
        return DefaultValues.stringLiteral(text);
    }

    /**
     * Content of a single-quoted SQL literal, if {@code expr} is one.
     */
    protected Optional<String> unquoteLiteral(String expr) {
        Matcher m = QUOTED_LITERAL.matcher(expr);
        return m.matches() ? Optional.of(m.group(1).replace("''", "'")) : Optional.empty();
    }

    protected static boolean isCurrentTimestamp(String expr) {
        String e = expr.toUpperCase(Locale.ROOT);
        return e.matches("CURRENT_TIMESTAMP(\\(\\d*\\))?") || e.equals("NOW()");
    }

    protected static String stripParentheses(String expr) {
        return DefaultValues.stripParentheses(expr);
    }
}
