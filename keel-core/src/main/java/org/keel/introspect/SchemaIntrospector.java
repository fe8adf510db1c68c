package org.keel.introspect;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.IntrospectionException;
import org.keel.history.MigrationLedger;
import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.dialect.Dialect;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the live structure of a database into the canonical model. Either every table is
 * read or the whole call fails.
 */
@Slf4j
public class SchemaIntrospector {

    public SchemaModel introspect(Connection connection, Dialect dialect) {
        IntrospectionQueries queries = dialect.introspectionQueries();
        List<String> tables;
        try {
            tables = queries.listTables(connection);
        } catch (SQLException e) {
            throw new IntrospectionException("Failed to list tables: " + e.getMessage(), e);
        }

        SchemaModel schema = SchemaModel.empty();
        Map<String, SQLException> failed = new LinkedHashMap<>();
        for (String table : tables) {
            if (table.equalsIgnoreCase(MigrationLedger.TABLE_NAME)) {
                continue;
            }
            try {
                schema.addTable(readTable(connection, dialect, queries, table));
            } catch (SQLException e) {
                log.debug("Introspection of table {} failed", table, e);
                failed.put(table, e);
            }
        }
        if (!failed.isEmpty()) {
            throw new IntrospectionException(new ArrayList<>(failed.keySet()), failed.values().iterator().next());
        }
        log.debug("Introspected {} table(s) on {}", schema.getTables().size(), dialect.getDatabaseType());
        return schema;
    }

    private TableModel readTable(Connection connection, Dialect dialect, IntrospectionQueries queries, String name)
            throws SQLException {
        TableModel table = TableModel.builder().tableName(name).build();

        IntrospectionQueries.PrimaryKeyRow pk = queries.primaryKey(connection, name);
        table.setPrimaryKey(new ArrayList<>(pk.columns()));
        table.setPrimaryKeyName(pk.name());

        for (IntrospectionQueries.ColumnRow row : queries.columns(connection, name)) {
            String type = dialect.getTypeMapper().normalize(row.rawType());
            table.addColumn(ColumnModel.builder()
                    .columnName(row.name())
                    .sqlType(type)
                    .isNullable(row.nullable())
                    .isPrimaryKey(pk.columns().contains(row.name()))
                    .defaultValue(dialect.normalizeDefault(row, type))
                    .build());
        }

        for (IntrospectionQueries.IndexRow row : queries.indexes(connection, name)) {
            IndexModel index = IndexModel.builder()
                    .indexName(row.name())
                    .isUnique(row.unique())
                    .constraintBacked(row.constraintBacked())
                    .columns(new ArrayList<>(row.columns()))
                    .build();
            table.getIndexes().add(index);
            if (index.getColumns().size() == 1 && index.isSingleColumnUniqueOn(index.getColumns().get(0).getColumnName())) {
                table.findColumn(index.getColumns().get(0).getColumnName()).ifPresent(c -> c.setUnique(true));
            }
        }

        for (IntrospectionQueries.ForeignKeyRow row : queries.foreignKeys(connection, name)) {
            table.getForeignKeys().add(ForeignKeyModel.builder()
                    .constraintName(row.name())
                    .columns(new ArrayList<>(row.columns()))
                    .referencedTable(row.referencedTable())
                    .referencedColumns(new ArrayList<>(row.referencedColumns()))
                    .onDelete(row.onDelete())
                    .onUpdate(row.onUpdate())
                    .build());
        }
        return table;
    }
}
