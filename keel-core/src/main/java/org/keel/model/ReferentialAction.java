package org.keel.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ReferentialAction {
    CASCADE("Cascade", "CASCADE"),
    RESTRICT("Restrict", "RESTRICT"),
    NO_ACTION("NoAction", "NO ACTION"),
    SET_NULL("SetNull", "SET NULL"),
    SET_DEFAULT("SetDefault", "SET DEFAULT");

    private final String declaredName;
    private final String sql;

    ReferentialAction(String declaredName, String sql) {
        this.declaredName = declaredName;
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    public static Optional<ReferentialAction> fromDeclaredName(String name) {
        return Arrays.stream(values()).filter(a -> a.declaredName.equals(name)).findFirst();
    }

    /**
     * Parses catalog spellings such as {@code NO ACTION} or {@code SET_NULL}.
     */
    public static ReferentialAction fromSql(String sql) {
        if (sql == null || sql.isBlank()) {
            return NO_ACTION;
        }
        String normalized = sql.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        return Arrays.stream(values())
                .filter(a -> a.sql.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown referential action: " + sql));
    }
}
