package org.keel.migration.dialect.sqlite;

import org.keel.migration.AbstractDialect;
import org.keel.migration.ColumnChangePolicy;
import org.keel.migration.CreateTableBuilder;
import org.keel.migration.DatabaseType;
import org.keel.migration.contributor.create.ColumnContributor;
import org.keel.migration.contributor.create.ForeignKeyContributor;
import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.TypeMapper;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SQLite can add columns and indexes in place; everything else rebuilds the table.
 */
public class SqliteDialect extends AbstractDialect {

    static final String REDEFINED_PREFIX = "new_";

    private final ColumnChangePolicy policy = ColumnChangePolicy.redefining();

    public SqliteDialect() {
        super();
    }

    // for tests
    public SqliteDialect(TypeMapper typeMapper, IntrospectionQueries introspectionQueries) {
        this.typeMapper = typeMapper;
        this.introspectionQueries = introspectionQueries;
    }

    @Override
    protected TypeMapper initializeTypeMapper() {
        return new SqliteTypeMapper();
    }

    @Override
    protected IntrospectionQueries initializeIntrospectionQueries() {
        return new SqliteIntrospectionQueries();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    public CaseNormalizer identifierNormalizer() {
        return CaseNormalizer.lower();
    }

    @Override
    public ColumnChangePolicy columnChangePolicy() {
        return policy;
    }

    @Override
    public boolean supportsTransactionalDdl() {
        return true;
    }

    /**
     * A private in-memory database, discarded when its connection closes.
     */
    @Override
    public Optional<String> defaultShadowDatabaseUrl() {
        return Optional.of("jdbc:sqlite::memory:");
    }

    // Column

    @Override
    protected String columnType(ColumnModel c) {
        return c.isAutoIncrement() ? "INTEGER" : c.getSqlType();
    }

    @Override
    protected String getIdentityClause(ColumnModel c) {
        return " PRIMARY KEY AUTOINCREMENT";
    }

    @Override
    public String getModifyColumnSql(String table, ChangeSet.ColumnChange change) {
        throw new UnsupportedOperationException("SQLite redefines the table to modify column " + change.getNewColumn().getColumnName());
    }

    // Primary key

    /**
     * Empty when the key is an autoincrement column, which declares the key inline.
     */
    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns, List<ColumnModel> columns) {
        boolean inline = pkColumns.size() == 1 && columns.stream()
                .anyMatch(c -> c.getColumnName().equals(pkColumns.get(0)) && c.isAutoIncrement());
        return inline ? "" : super.getPrimaryKeyDefinitionSql(pkColumns, columns);
    }

    @Override
    public String getAddPrimaryKeySql(String table, List<String> pkColumns) {
        throw new UnsupportedOperationException("SQLite redefines the table to add a primary key");
    }

    @Override
    public String getDropPrimaryKeySql(ChangeSet.AlteredTable table) {
        throw new UnsupportedOperationException("SQLite redefines the table to drop a primary key");
    }

    // Indexes

    @Override
    public String getDropIndexSql(String table, IndexModel index) {
        return "DROP INDEX " + quoteIdentifier(index.getIndexName()) + ";\n";
    }

    // Foreign keys

    @Override
    public String getAddForeignKeySql(String table, ForeignKeyModel fk) {
        throw new UnsupportedOperationException("SQLite cannot add a foreign key to an existing table");
    }

    @Override
    public String getDropForeignKeySql(String table, ForeignKeyModel fk) {
        throw new UnsupportedOperationException("SQLite cannot drop a foreign key from an existing table");
    }

    @Override
    public boolean supportsForeignKeyAlteration() {
        return false;
    }

    // Redefinition

    @Override
    public boolean requiresRedefinition(ChangeSet.AlteredTable table) {
        if (!table.getDroppedColumns().isEmpty() || !table.getModifiedColumns().isEmpty()
                || table.getPrimaryKeyChange() != null
                || !table.getAddedForeignKeys().isEmpty() || !table.getDroppedForeignKeys().isEmpty()) {
            return true;
        }
        if (table.getAddedColumns().stream().anyMatch(c -> !canAddInPlace(c))) {
            return true;
        }
        return table.getDroppedIndexes().stream().anyMatch(IndexModel::isConstraintBacked);
    }

    /**
     * {@code ADD COLUMN} takes neither key columns, non-constant defaults nor required columns
     * without a default.
     */
    private boolean canAddInPlace(ColumnModel c) {
        if (c.isPrimaryKey() || c.isAutoIncrement()) {
            return false;
        }
        String def = DefaultValues.effective(c.getDefaultValue());
        if (def == null) {
            return c.isNullable();
        }
        return !DefaultValues.NOW.equals(def) && !DefaultValues.UUID.equals(def)
                && DefaultValues.dbGeneratedSql(def).isEmpty();
    }

    @Override
    public String getRedefineTableSql(ChangeSet.AlteredTable table) {
        TableModel oldTable = table.getOldTable();
        TableModel newTable = table.getNewTable();
        String name = table.getTableName();
        String temp = REDEFINED_PREFIX + name;

        StringBuilder sb = new StringBuilder();
        sb.append("PRAGMA defer_foreign_keys=ON;\n");
        sb.append("PRAGMA foreign_keys=OFF;\n");
        sb.append(new CreateTableBuilder(temp, this)
                .add(new ColumnContributor(newTable.getPrimaryKey(), newTable.getColumnList()))
                .add(new ForeignKeyContributor(newTable.getForeignKeys()))
                .build());

        List<String> common = newTable.getColumnList().stream()
                .map(ColumnModel::getColumnName)
                .filter(c -> oldTable.findColumn(c).isPresent())
                .toList();
        if (!common.isEmpty()) {
            String cols = quoteColumns(common);
            sb.append("INSERT INTO ").append(quoteIdentifier(temp)).append(" (").append(cols).append(")")
                    .append(" SELECT ").append(cols).append(" FROM ").append(quoteIdentifier(name)).append(";\n");
        }
        sb.append(getDropTableSql(name));
        sb.append("ALTER TABLE ").append(quoteIdentifier(temp)).append(" RENAME TO ").append(quoteIdentifier(name)).append(";\n");
        for (IndexModel idx : CreateTableBuilder.standaloneIndexes(newTable)) {
            sb.append(indexStatement(idx, name));
        }
        sb.append("PRAGMA foreign_keys=ON;\n");
        sb.append("PRAGMA defer_foreign_keys=OFF;\n");
        return sb.toString();
    }

    // Defaults

    @Override
    public String renderDefault(ColumnModel column) {
        Optional<String> raw = DefaultValues.dbGeneratedSql(column.getDefaultValue());
        if (raw.isPresent()) {
            return "(" + DefaultValues.canonicalSql(raw.get()) + ")";
        }
        return super.renderDefault(column);
    }

    @Override
    protected String uuidExpression() {
        return "(lower(hex(randomblob(16))))";
    }

    @Override
    protected String normalizeDefaultExpression(String expr, String canonicalType, boolean expression) {
        String e = stripParentheses(expr);
        Optional<String> literal = unquoteLiteral(e);
        if (literal.isPresent()) {
            return literalFor(literal.get(), canonicalType);
        }
        if (isCurrentTimestamp(e)) {
            return DefaultValues.NOW;
        }
        if (e.toLowerCase(Locale.ROOT).contains("randomblob(")) {
            return DefaultValues.UUID;
        }
        if (e.equalsIgnoreCase("true") || e.equalsIgnoreCase("false")) {
            return e.toLowerCase(Locale.ROOT);
        }
        if (DefaultValues.isNumber(e)) {
            return literalFor(e, canonicalType);
        }
        return DefaultValues.dbGenerated(e);
    }
}
