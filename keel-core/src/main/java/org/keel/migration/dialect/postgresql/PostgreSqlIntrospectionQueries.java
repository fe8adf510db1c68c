package org.keel.migration.dialect.postgresql;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog reads against {@code pg_catalog}, limited to {@code current_schema()}.
 */
public class PostgreSqlIntrospectionQueries implements IntrospectionQueries {

    static final String TABLES = """
            SELECT c.relname AS table_name
            FROM pg_catalog.pg_class c
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = current_schema()
              AND c.relkind IN ('r', 'p')
            ORDER BY c.relname
            """;

    static final String COLUMNS = """
            SELECT a.attname AS column_name,
                   pg_catalog.format_type(a.atttypid, a.atttypmod) AS data_type,
                   a.attnotnull AS not_null,
                   pg_catalog.pg_get_expr(d.adbin, d.adrelid) AS column_default,
                   a.attidentity AS identity
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_catalog.pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            WHERE n.nspname = current_schema()
              AND c.relname = ?
              AND a.attnum > 0
              AND NOT a.attisdropped
            ORDER BY a.attnum
            """;

    static final String PRIMARY_KEY = """
            SELECT con.conname AS constraint_name,
                   a.attname AS column_name
            FROM pg_catalog.pg_constraint con
            JOIN pg_catalog.pg_class c ON c.oid = con.conrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            CROSS JOIN LATERAL unnest(con.conkey) WITH ORDINALITY AS k(attnum, ord)
            JOIN pg_catalog.pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = k.attnum
            WHERE n.nspname = current_schema()
              AND c.relname = ?
              AND con.contype = 'p'
            ORDER BY k.ord
            """;

    static final String INDEXES = """
            SELECT ic.relname AS index_name,
                   i.indisunique AS is_unique,
                   (con.oid IS NOT NULL) AS constraint_backed,
                   pg_catalog.pg_get_indexdef(i.indexrelid, k.ord, true) AS column_expr,
                   (i.indoption[k.ord - 1] & 1) = 1 AS descending
            FROM pg_catalog.pg_index i
            JOIN pg_catalog.pg_class t ON t.oid = i.indrelid
            JOIN pg_catalog.pg_class ic ON ic.oid = i.indexrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = t.relnamespace
            LEFT JOIN pg_catalog.pg_constraint con
                   ON con.conindid = i.indexrelid AND con.conrelid = t.oid AND con.contype IN ('u', 'x')
            CROSS JOIN LATERAL generate_series(1, i.indnkeyatts) AS k(ord)
            WHERE n.nspname = current_schema()
              AND t.relname = ?
              AND NOT i.indisprimary
            ORDER BY ic.relname, k.ord
            """;

    static final String FOREIGN_KEYS = """
            SELECT con.conname AS constraint_name,
                   a.attname AS column_name,
                   rt.relname AS referenced_table,
                   ra.attname AS referenced_column,
                   con.confdeltype AS delete_rule,
                   con.confupdtype AS update_rule
            FROM pg_catalog.pg_constraint con
            JOIN pg_catalog.pg_class c ON c.oid = con.conrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            JOIN pg_catalog.pg_class rt ON rt.oid = con.confrelid
            CROSS JOIN LATERAL unnest(con.conkey, con.confkey) WITH ORDINALITY AS k(attnum, refnum, ord)
            JOIN pg_catalog.pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = k.attnum
            JOIN pg_catalog.pg_attribute ra ON ra.attrelid = con.confrelid AND ra.attnum = k.refnum
            WHERE n.nspname = current_schema()
              AND c.relname = ?
              AND con.contype = 'f'
            ORDER BY con.conname, k.ord
            """;

    private static final Pattern PLAIN_COLUMN = Pattern.compile("^\"?([^\"()]+)\"?$");
    private static final Pattern FUNCTION_COLUMN = Pattern.compile("^(\\w+)\\(\\(?\"?([\\w$]+)\"?\\)?(::[\\w ]+)?\\)$");

    @Override
    public List<String> listTables(Connection connection) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(TABLES);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tables.add(rs.getString("table_name"));
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
                    String def = rs.getString("column_default");
                    String identity = rs.getString("identity");
                    boolean autoIncrement = (def != null && def.startsWith("nextval("))
                            || "a".equals(identity) || "d".equals(identity);
                    rows.add(new ColumnRow(
                            rs.getString("column_name"),
                            rs.getString("data_type"),
                            !rs.getBoolean("not_null"),
                            def,
                            autoIncrement,
                            false));
                }
            }
        }
        return rows;
    }

    @Override
    public PrimaryKeyRow primaryKey(Connection connection, String table) throws SQLException {
        String name = null;
        List<String> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(PRIMARY_KEY)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    name = rs.getString("constraint_name");
                    columns.add(rs.getString("column_name"));
                }
            }
        }
        return columns.isEmpty() ? PrimaryKeyRow.none() : new PrimaryKeyRow(name, columns);
    }

    @Override
    public List<IndexRow> indexes(Connection connection, String table) throws SQLException {
        Map<String, IndexRow> byName = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(INDEXES)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("index_name");
                    IndexRow row = byName.get(name);
                    if (row == null) {
                        row = new IndexRow(name, rs.getBoolean("is_unique"), rs.getBoolean("constraint_backed"), new ArrayList<>());
                        byName.put(name, row);
                    }
                    IndexColumn column = parseIndexColumn(rs.getString("column_expr"));
                    if (rs.getBoolean("descending")) {
                        column.setSortOrder(IndexColumn.SortOrder.DESC);
                    }
                    row.columns().add(column);
                }
            }
        }
        return new ArrayList<>(byName.values());
    }

    static IndexColumn parseIndexColumn(String expr) {
        String e = expr.trim();
        Matcher plain = PLAIN_COLUMN.matcher(e);
        if (plain.matches()) {
            return IndexColumn.of(plain.group(1));
        }
        Matcher fn = FUNCTION_COLUMN.matcher(e);
        if (fn.matches()) {
            return IndexColumn.builder().columnName(fn.group(2)).function(fn.group(1).toLowerCase(Locale.ROOT)).build();
        }
        return IndexColumn.builder().columnName(e).function("expression").build();
    }

    @Override
    public List<ForeignKeyRow> foreignKeys(Connection connection, String table) throws SQLException {
        Map<String, ForeignKeyRow> byName = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(FOREIGN_KEYS)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("constraint_name");
                    ForeignKeyRow row = byName.get(name);
                    if (row == null) {
                        row = new ForeignKeyRow(name, new ArrayList<>(), rs.getString("referenced_table"),
                                new ArrayList<>(), action(rs.getString("delete_rule")), action(rs.getString("update_rule")));
                        byName.put(name, row);
                    }
                    row.columns().add(rs.getString("column_name"));
                    row.referencedColumns().add(rs.getString("referenced_column"));
                }
            }
        }
        return new ArrayList<>(byName.values());
    }

    static ReferentialAction action(String code) {
        if (code == null) {
            return ReferentialAction.NO_ACTION;
        }
        return switch (code) {
            case "r" -> ReferentialAction.RESTRICT;
            case "c" -> ReferentialAction.CASCADE;
            case "n" -> ReferentialAction.SET_NULL;
            case "d" -> ReferentialAction.SET_DEFAULT;
            default -> ReferentialAction.NO_ACTION;
        };
    }
}
