package org.keel.migration.dialect.mysql;

import org.keel.migration.spi.IntrospectionQueries;
import org.keel.model.IndexColumn;
import org.keel.model.ReferentialAction;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catalog reads against {@code information_schema} for the connection's {@code DATABASE()}.
 */
public class MySqlIntrospectionQueries implements IntrospectionQueries {

    static final String TABLES = """
            SELECT TABLE_NAME
            FROM information_schema.TABLES
            WHERE TABLE_SCHEMA = DATABASE()
              AND TABLE_TYPE = 'BASE TABLE'
            ORDER BY TABLE_NAME
            """;

    static final String COLUMNS = """
            SELECT COLUMN_NAME, COLUMN_TYPE, IS_NULLABLE, COLUMN_DEFAULT, EXTRA
            FROM information_schema.COLUMNS
            WHERE TABLE_SCHEMA = DATABASE()
              AND TABLE_NAME = ?
            ORDER BY ORDINAL_POSITION
            """;

    static final String PRIMARY_KEY = """
            SELECT COLUMN_NAME
            FROM information_schema.STATISTICS
            WHERE TABLE_SCHEMA = DATABASE()
              AND TABLE_NAME = ?
              AND INDEX_NAME = 'PRIMARY'
            ORDER BY SEQ_IN_INDEX
            """;

    // indexes MySQL creates on its own for foreign keys are left out
    static final String INDEXES = """
            SELECT s.INDEX_NAME, s.NON_UNIQUE, s.COLUMN_NAME, s.COLLATION
            FROM information_schema.STATISTICS s
            WHERE s.TABLE_SCHEMA = DATABASE()
              AND s.TABLE_NAME = ?
              AND s.INDEX_NAME <> 'PRIMARY'
              AND s.INDEX_NAME NOT IN (
                  SELECT tc.CONSTRAINT_NAME
                  FROM information_schema.TABLE_CONSTRAINTS tc
                  WHERE tc.TABLE_SCHEMA = DATABASE()
                    AND tc.TABLE_NAME = s.TABLE_NAME
                    AND tc.CONSTRAINT_TYPE = 'FOREIGN KEY')
            ORDER BY s.INDEX_NAME, s.SEQ_IN_INDEX
            """;

    static final String FOREIGN_KEYS = """
            SELECT k.CONSTRAINT_NAME, k.COLUMN_NAME, k.REFERENCED_TABLE_NAME, k.REFERENCED_COLUMN_NAME,
                   r.DELETE_RULE, r.UPDATE_RULE
            FROM information_schema.KEY_COLUMN_USAGE k
            JOIN information_schema.REFERENTIAL_CONSTRAINTS r
              ON r.CONSTRAINT_SCHEMA = k.CONSTRAINT_SCHEMA
             AND r.CONSTRAINT_NAME = k.CONSTRAINT_NAME
            WHERE k.TABLE_SCHEMA = DATABASE()
              AND k.TABLE_NAME = ?
              AND k.REFERENCED_TABLE_NAME IS NOT NULL
            ORDER BY k.CONSTRAINT_NAME, k.ORDINAL_POSITION
            """;

    @Override
    public List<String> listTables(Connection connection) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(TABLES);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        return tables;
    }

    @Override
    public List<ColumnRow> columns(Connection connection, String table) throws SQLException {
        List<ColumnRow> rows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(COLUMNS)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String extra = rs.getString("EXTRA");
                    extra = extra == null ? "" : extra.toLowerCase(Locale.ROOT);
                    rows.add(new ColumnRow(
                            rs.getString("COLUMN_NAME"),
                            rs.getString("COLUMN_TYPE"),
                            "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")),
                            rs.getString("COLUMN_DEFAULT"),
                            extra.contains("auto_increment"),
                            extra.contains("default_generated")));
                }
            }
        }
        return rows;
    }

    @Override
    public PrimaryKeyRow primaryKey(Connection connection, String table) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(PRIMARY_KEY)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME"));
                }
            }
        }
        return columns.isEmpty() ? PrimaryKeyRow.none() : new PrimaryKeyRow("PRIMARY", columns);
    }

    @Override
    public List<IndexRow> indexes(Connection connection, String table) throws SQLException {
        Map<String, IndexRow> byName = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(INDEXES)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("INDEX_NAME");
                    IndexRow row = byName.get(name);
                    if (row == null) {
                        row = new IndexRow(name, rs.getInt("NON_UNIQUE") == 0, false, new ArrayList<>());
                        byName.put(name, row);
                    }
                    String columnName = rs.getString("COLUMN_NAME");
                    if (columnName == null) {
                        // functional key part
                        columnName = "expression";
                    }
                    IndexColumn column = IndexColumn.of(columnName);
                    if ("D".equals(rs.getString("COLLATION"))) {
                        column.setSortOrder(IndexColumn.SortOrder.DESC);
                    }
                    row.columns().add(column);
                }
            }
        }
        return new ArrayList<>(byName.values());
    }

    @Override
    public List<ForeignKeyRow> foreignKeys(Connection connection, String table) throws SQLException {
        Map<String, ForeignKeyRow> byName = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(FOREIGN_KEYS)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("CONSTRAINT_NAME");
                    ForeignKeyRow row = byName.get(name);
                    if (row == null) {
                        row = new ForeignKeyRow(name, new ArrayList<>(), rs.getString("REFERENCED_TABLE_NAME"),
                                new ArrayList<>(),
                                ReferentialAction.fromSql(rs.getString("DELETE_RULE")),
                                ReferentialAction.fromSql(rs.getString("UPDATE_RULE")));
                        byName.put(name, row);
                    }
                    row.columns().add(rs.getString("COLUMN_NAME"));
                    row.referencedColumns().add(rs.getString("REFERENCED_COLUMN_NAME"));
                }
            }
        }
        return new ArrayList<>(byName.values());
    }
}
