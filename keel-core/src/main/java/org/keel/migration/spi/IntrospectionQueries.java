package org.keel.migration.spi;

import org.keel.model.IndexColumn;
import org.keel.model.ReferentialAction;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Catalog reads for one provider. Rows carry raw catalog values; normalization into the
 * canonical vocabulary happens in the dialect.
 */
public interface IntrospectionQueries {

    List<String> listTables(Connection connection) throws SQLException;

    List<ColumnRow> columns(Connection connection, String table) throws SQLException;

    PrimaryKeyRow primaryKey(Connection connection, String table) throws SQLException;

    List<IndexRow> indexes(Connection connection, String table) throws SQLException;

    List<ForeignKeyRow> foreignKeys(Connection connection, String table) throws SQLException;

    /**
     * @param autoIncrement the column draws values from an identity, sequence or AUTOINCREMENT
     * @param expressionDefault the default is an expression rather than a literal
     */
    record ColumnRow(String name, String rawType, boolean nullable, String rawDefault,
                     boolean autoIncrement, boolean expressionDefault) {
    }

    record PrimaryKeyRow(String name, List<String> columns) {
        public static PrimaryKeyRow none() {
            return new PrimaryKeyRow(null, List.of());
        }
    }

    record IndexRow(String name, boolean unique, boolean constraintBacked, List<IndexColumn> columns) {
    }

    record ForeignKeyRow(String name, List<String> columns, String referencedTable,
                         List<String> referencedColumns, ReferentialAction onDelete, ReferentialAction onUpdate) {
    }
}
