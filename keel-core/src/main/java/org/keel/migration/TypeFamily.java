package org.keel.migration;

import java.util.Locale;

/**
 * Coarse grouping of SQL types used to decide how a type change can be carried out.
 */
public enum TypeFamily {
    TEXT, INTEGER, DECIMAL, FLOAT, BOOLEAN, DATETIME, JSON, BINARY, UUID, OTHER;

    public static TypeFamily of(String sqlType) {
        if (sqlType == null || sqlType.isBlank()) {
            return OTHER;
        }
        String t = sqlType.trim().toUpperCase(Locale.ROOT);
        if (t.endsWith("[]")) {
            return OTHER;
        }
        int paren = t.indexOf('(');
        String base = (paren >= 0 ? t.substring(0, paren) : t).trim();
        return switch (base) {
            case "TEXT", "VARCHAR", "CHAR", "CHARACTER", "CHARACTER VARYING", "CITEXT",
                    "TINYTEXT", "MEDIUMTEXT", "LONGTEXT", "NVARCHAR", "CLOB" -> TEXT;
            case "SMALLINT", "INTEGER", "INT", "BIGINT", "MEDIUMINT", "INT UNSIGNED",
                    "BIGINT UNSIGNED", "SERIAL", "BIGSERIAL", "SMALLSERIAL", "YEAR" -> INTEGER;
            case "TINYINT" -> t.equals("TINYINT(1)") ? BOOLEAN : INTEGER;
            case "DECIMAL", "NUMERIC", "MONEY" -> DECIMAL;
            case "REAL", "FLOAT", "DOUBLE", "DOUBLE PRECISION" -> FLOAT;
            case "BOOLEAN", "BOOL", "BIT" -> BOOLEAN;
            case "TIMESTAMP", "TIMESTAMPTZ", "DATETIME", "DATE", "TIME", "TIMETZ" -> DATETIME;
            case "JSON", "JSONB" -> JSON;
            case "BYTEA", "BLOB", "LONGBLOB", "MEDIUMBLOB", "TINYBLOB", "BINARY", "VARBINARY" -> BINARY;
            case "UUID" -> UUID;
            default -> OTHER;
        };
    }
}
