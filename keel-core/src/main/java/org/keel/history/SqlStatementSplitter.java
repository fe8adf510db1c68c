package org.keel.history;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script on {@code ;} outside of string literals, quoted identifiers, comments and
 * PostgreSQL dollar-quoted bodies. Statements consisting only of comments are dropped.
 */
public final class SqlStatementSplitter {

    private SqlStatementSplitter() {
    }

    public static List<String> split(String sql) {
        return split(sql, false);
    }

    /**
     * @param backslashEscapes whether a backslash escapes a quote inside literals (MySQL)
     */
    public static List<String> split(String sql, boolean backslashEscapes) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean hasCode = false;
        int i = 0;
        int n = sql.length();

        while (i < n) {
            char c = sql.charAt(i);

            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end == -1 ? n : end;
                current.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end == -1 ? n : end + 2;
                current.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                int end = closingQuote(sql, i, c, backslashEscapes);
                current.append(sql, i, end);
                hasCode = true;
                i = end;
                continue;
            }
            if (c == '$') {
                String tag = dollarTag(sql, i);
                if (tag != null) {
                    int close = sql.indexOf(tag, i + tag.length());
                    int end = close == -1 ? n : close + tag.length();
                    current.append(sql, i, end);
                    hasCode = true;
                    i = end;
                    continue;
                }
            }
            if (c == ';') {
                if (hasCode) {
                    statements.add(current.toString().strip());
                }
                current.setLength(0);
                hasCode = false;
                i++;
                continue;
            }
            if (!Character.isWhitespace(c)) {
                hasCode = true;
            }
            current.append(c);
            i++;
        }
        if (hasCode) {
            statements.add(current.toString().strip());
        }
        return statements;
    }

    /**
     * Index just past the closing quote; a doubled quote escapes it.
     */
    private static int closingQuote(String sql, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\' && quote != '`' && i + 1 < sql.length()) {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /**
     * {@code $$} or {@code $tag$} starting at {@code start}, or null.
     */
    private static String dollarTag(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '$') {
                return sql.substring(start, i + 1);
            }
            if (!(Character.isLetterOrDigit(c) || c == '_') || (i == start + 1 && Character.isDigit(c))) {
                return null;
            }
            i++;
        }
        return null;
    }
}
