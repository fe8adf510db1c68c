package org.keel.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical default expressions shared by the declaration mapper and the introspectors:
 * string literals in double quotes, plain numbers, {@code true}/{@code false} and the
 * functions {@code autoincrement()}, {@code now()}, {@code uuid()}, {@code cuid()} and
 * {@code dbgenerated("sql")}.
 */
public final class DefaultValues {

    public static final String AUTOINCREMENT = "autoincrement()";
    public static final String NOW = "now()";
    public static final String UUID = "uuid()";
    public static final String CUID = "cuid()";

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern DB_GENERATED = Pattern.compile("^dbgenerated\\(\"(.*)\"\\)$", Pattern.DOTALL);

    private DefaultValues() {
    }

    public static boolean isAutoIncrement(String expr) {
        return AUTOINCREMENT.equals(expr);
    }

    /**
     * Defaults produced by the client, with no database-side counterpart.
     */
    public static boolean isClientGenerated(String expr) {
        return CUID.equals(expr);
    }

    public static String stringLiteral(String raw) {
        return "\"" + raw.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    public static boolean isStringLiteral(String expr) {
        return expr != null && expr.length() >= 2 && expr.startsWith("\"") && expr.endsWith("\"");
    }

    public static Optional<String> stringValue(String expr) {
        if (!isStringLiteral(expr)) {
            return Optional.empty();
        }
        String body = expr.substring(1, expr.length() - 1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                sb.append(body.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return Optional.of(sb.toString());
    }

    public static boolean isNumber(String expr) {
        return expr != null && NUMBER.matcher(expr).matches();
    }

    public static String number(String text) {
        return new BigDecimal(text.trim()).stripTrailingZeros().toPlainString();
    }

    public static boolean isBoolean(String expr) {
        return "true".equals(expr) || "false".equals(expr);
    }

    /**
     * Wraps raw SQL as {@code dbgenerated("sql")}. The SQL is stored in its canonical
     * spelling, see {@link #canonicalSql(String)}.
     */
    public static String dbGenerated(String sql) {
        return "dbgenerated(" + stringLiteral(canonicalSql(sql)) + ")";
    }

    /**
     * Canonical spelling of a raw SQL expression: fully wrapping parentheses are removed and
     * runs of whitespace outside single-quoted literals become one space. {@code "(datetime('now'))"}
     * and {@code "datetime( 'now' )"} differ, {@code "( datetime('now') )"} and
     * {@code "datetime('now')"} do not.
     */
    public static String canonicalSql(String sql) {
        String e = stripParentheses(sql);
        StringBuilder sb = new StringBuilder(e.length());
        boolean quoted = false;
        boolean space = false;
        for (int i = 0; i < e.length(); i++) {
            char c = e.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            if (!quoted && Character.isWhitespace(c)) {
                space = true;
                continue;
            }
            if (space) {
                sb.append(' ');
                space = false;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Removes parentheses that wrap the whole expression, repeatedly.
     */
    public static String stripParentheses(String expr) {
        String e = expr.trim();
        while (e.startsWith("(") && e.endsWith(")") && balanced(e.substring(1, e.length() - 1))) {
            e = e.substring(1, e.length() - 1).trim();
        }
        return e;
    }

    private static boolean balanced(String s) {
        int depth = 0;
        boolean quoted = false;
        for (char c : s.toCharArray()) {
            if (c == '\'') quoted = !quoted;
            if (quoted) continue;
            if (c == '(') depth++;
            if (c == ')' && --depth < 0) return false;
        }
        return depth == 0;
    }

    public static Optional<String> dbGeneratedSql(String expr) {
        if (expr == null) {
            return Optional.empty();
        }
        Matcher m = DB_GENERATED.matcher(expr);
        return m.matches() ? stringValue("\"" + m.group(1) + "\"") : Optional.empty();
    }

    /**
     * The default as the database sees it: client-generated values count as none.
     */
    public static String effective(String expr) {
        if (expr == null || isClientGenerated(expr)) {
            return null;
        }
        if (isNumber(expr)) {
            return number(expr);
        }
        return dbGeneratedSql(expr).map(DefaultValues::dbGenerated).orElse(expr);
    }

    public static boolean same(String left, String right) {
        return Objects.equals(effective(left), effective(right));
    }
}
