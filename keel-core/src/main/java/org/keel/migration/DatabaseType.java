package org.keel.migration;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported database providers with their declaration name and JDBC prefix.
 */
@Getter
public enum DatabaseType {
    POSTGRESQL("postgresql", "jdbc:postgresql:"),
    MYSQL("mysql", "jdbc:mysql:"),
    SQLITE("sqlite", "jdbc:sqlite:");

    private final String providerName;
    private final String jdbcPrefix;

    DatabaseType(String providerName, String jdbcPrefix) {
        this.providerName = providerName;
        this.jdbcPrefix = jdbcPrefix;
    }

    /**
     * Parse a declaration {@code provider} value (case-insensitive).
     */
    public static DatabaseType fromProvider(String provider) {
        if (provider == null || provider.isEmpty()) {
            throw new IllegalArgumentException("Database provider cannot be null or empty");
        }
        for (DatabaseType type : values()) {
            if (type.providerName.equalsIgnoreCase(provider)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported database provider: " + provider);
    }

    /**
     * Detects the provider from a connection string scheme. Unknown schemes fall back to
     * PostgreSQL.
     */
    public static DatabaseType fromUrl(String url) {
        return detect(url).orElse(POSTGRESQL);
    }

    static Optional<DatabaseType> detect(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String u = url.trim().toLowerCase(Locale.ROOT);
        if (u.startsWith("jdbc:")) {
            u = u.substring("jdbc:".length());
        }
        if (u.startsWith("postgres://") || u.startsWith("postgresql:")) {
            return Optional.of(POSTGRESQL);
        }
        if (u.startsWith("mysql:")) {
            return Optional.of(MYSQL);
        }
        if (u.startsWith("file:") || u.startsWith("sqlite:")) {
            return Optional.of(SQLITE);
        }
        return Optional.empty();
    }

    /**
     * The declaration's provider wins over the URL scheme.
     */
    public static DatabaseType resolve(Optional<String> declaredProvider, String url) {
        return declaredProvider.map(DatabaseType::fromProvider).orElseGet(() -> fromUrl(url));
    }
}
