package org.keel.migration.spi.dialect;

import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;

import java.util.List;

public interface DdlDialect extends Dialect {
    // Table
    String openCreateTable(String tableName);
    String closeCreateTable();
    String getCreateTableSql(TableModel table, boolean inlineForeignKeys);
    String getDropTableSql(String tableName);

    // Column
    String getColumnDefinitionSql(ColumnModel column);
    String getAddColumnSql(String table, ColumnModel column);
    String getDropColumnSql(String table, ColumnModel column);
    String getModifyColumnSql(String table, ChangeSet.ColumnChange change);

    // Primary Key
    String getPrimaryKeyDefinitionSql(List<String> pkColumns, List<ColumnModel> columns);
    String getAddPrimaryKeySql(String table, List<String> pkColumns);
    String getDropPrimaryKeySql(ChangeSet.AlteredTable table);

    // Indexes
    String indexStatement(IndexModel idx, String table);
    String getDropIndexSql(String table, IndexModel index);

    // Foreign keys
    String getForeignKeyDefinitionSql(ForeignKeyModel fk);
    String getAddForeignKeySql(String table, ForeignKeyModel fk);
    String getDropForeignKeySql(String table, ForeignKeyModel fk);

    /**
     * Whether foreign keys can be added to and dropped from an existing table.
     */
    boolean supportsForeignKeyAlteration();

    /**
     * Whether the table must be rebuilt to carry out the alteration.
     */
    boolean requiresRedefinition(ChangeSet.AlteredTable table);

    /**
     * Statements rebuilding {@code table} into its new shape while keeping its data.
     */
    default String getRedefineTableSql(ChangeSet.AlteredTable table) {
        throw new UnsupportedOperationException(getDatabaseType() + " alters tables in place");
    }
}
