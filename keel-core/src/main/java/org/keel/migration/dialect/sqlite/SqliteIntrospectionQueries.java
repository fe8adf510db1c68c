package org.keel.migration.dialect.sqlite;

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
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Reads {@code sqlite_master} and the table-valued {@code PRAGMA} functions.
 */
public class SqliteIntrospectionQueries implements IntrospectionQueries {

    static final String TABLES =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";
    static final String TABLE_SQL = "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?";
    static final String TABLE_INFO = "SELECT name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?) ORDER BY cid";
    static final String INDEX_LIST = "SELECT name, \"unique\", origin FROM pragma_index_list(?)";
    static final String INDEX_COLUMNS =
            "SELECT name, \"desc\" FROM pragma_index_xinfo(?) WHERE key = 1 ORDER BY seqno";
    static final String FOREIGN_KEYS =
            "SELECT id, \"table\", \"from\", \"to\", on_update, on_delete FROM pragma_foreign_key_list(?) ORDER BY id, seq";

    private static final Pattern AUTOINCREMENT = Pattern.compile("\\bAUTOINCREMENT\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public List<String> listTables(Connection connection) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(TABLES);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tables.add(rs.getString("name"));
            }
        }
        return tables;
    }

    @Override
    public List<ColumnRow> columns(Connection connection, String table) throws SQLException {
        boolean autoIncrementTable = AUTOINCREMENT.matcher(tableSql(connection, table)).find();
        List<RawColumn> raw = new ArrayList<>();
        int pkCount = 0;
        try (PreparedStatement ps = connection.prepareStatement(TABLE_INFO)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    RawColumn c = new RawColumn(rs.getString("name"), rs.getString("type"),
                            rs.getInt("notnull") == 1, rs.getString("dflt_value"), rs.getInt("pk"));
                    if (c.pk > 0) pkCount++;
                    raw.add(c);
                }
            }
        }
        List<ColumnRow> rows = new ArrayList<>();
        for (RawColumn c : raw) {
            boolean autoIncrement = autoIncrementTable && pkCount == 1 && c.pk > 0
                    && c.type.equalsIgnoreCase("INTEGER");
            // key columns are implicitly required
            boolean nullable = !c.notNull && c.pk == 0;
            rows.add(new ColumnRow(c.name, c.type, nullable, c.defaultValue, autoIncrement, false));
        }
        return rows;
    }

    @Override
    public PrimaryKeyRow primaryKey(Connection connection, String table) throws SQLException {
        Map<Integer, String> ordered = new TreeMap<>();
        try (PreparedStatement ps = connection.prepareStatement(TABLE_INFO)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int pk = rs.getInt("pk");
                    if (pk > 0) {
                        ordered.put(pk, rs.getString("name"));
                    }
                }
            }
        }
        return ordered.isEmpty() ? PrimaryKeyRow.none() : new PrimaryKeyRow(null, new ArrayList<>(ordered.values()));
    }

    @Override
    public List<IndexRow> indexes(Connection connection, String table) throws SQLException {
        List<IndexRow> rows = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(INDEX_LIST)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String origin = rs.getString("origin");
                    if ("pk".equals(origin)) {
                        continue;
                    }
                    rows.add(new IndexRow(rs.getString("name"), rs.getInt("unique") == 1,
                            "u".equals(origin), new ArrayList<>()));
                }
            }
        }
        for (IndexRow row : rows) {
            try (PreparedStatement ps = connection.prepareStatement(INDEX_COLUMNS)) {
                ps.setString(1, row.name());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String name = rs.getString("name");
                        IndexColumn column = IndexColumn.of(name == null ? "expression" : name);
                        if (rs.getInt("desc") == 1) {
                            column.setSortOrder(IndexColumn.SortOrder.DESC);
                        }
                        row.columns().add(column);
                    }
                }
            }
        }
        rows.sort((a, b) -> a.name().compareTo(b.name()));
        return rows;
    }

    @Override
    public List<ForeignKeyRow> foreignKeys(Connection connection, String table) throws SQLException {
        Map<Integer, ForeignKeyRow> byId = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(FOREIGN_KEYS)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int id = rs.getInt("id");
                    ForeignKeyRow row = byId.get(id);
                    if (row == null) {
                        row = new ForeignKeyRow(null, new ArrayList<>(), rs.getString("table"), new ArrayList<>(),
                                ReferentialAction.fromSql(rs.getString("on_delete")),
                                ReferentialAction.fromSql(rs.getString("on_update")));
                        byId.put(id, row);
                    }
                    row.columns().add(rs.getString("from"));
                    row.referencedColumns().add(rs.getString("to"));
                }
            }
        }
        return new ArrayList<>(byId.values());
    }

    private String tableSql(Connection connection, String table) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(TABLE_SQL)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                String sql = rs.next() ? rs.getString("sql") : null;
                return sql == null ? "" : sql.toUpperCase(Locale.ROOT);
            }
        }
    }

    private record RawColumn(String name, String type, boolean notNull, String defaultValue, int pk) {
    }
}
