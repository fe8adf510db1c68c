package org.keel.migration.spi.dialect;

import org.keel.migration.ColumnChangePolicy;
import org.keel.migration.DatabaseType;
import org.keel.migration.spi.IntrospectionQueries;
import org.keel.migration.spi.TypeMapper;
import org.keel.model.ColumnModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.Optional;

/**
 * Capabilities of one database provider. One implementation per provider; callers never
 * branch on the provider name.
 */
public interface Dialect {

    DatabaseType getDatabaseType();

    TypeMapper getTypeMapper();

    String quoteIdentifier(String raw);

    /**
     * SQL text of the column's default, or null when no {@code DEFAULT} clause is rendered.
     */
    String renderDefault(ColumnModel column);

    /**
     * Canonical default expression for a catalog default.
     *
     * @param row raw column row as read from the catalog
     * @param canonicalType normalized type of the column
     */
    String normalizeDefault(IntrospectionQueries.ColumnRow row, String canonicalType);

    IntrospectionQueries introspectionQueries();

    CaseNormalizer identifierNormalizer();

    boolean isIndexColumnOrderSignificant();

    ColumnChangePolicy columnChangePolicy();

    boolean supportsTransactionalDdl();

    /**
     * Whether a backslash escapes the quote character inside string literals.
     */
    default boolean backslashEscapesInLiterals() {
        return false;
    }

    /**
     * Scratch database used for drift detection when none is configured.
     */
    default Optional<String> defaultShadowDatabaseUrl() {
        return Optional.empty();
    }

    /**
     * Longest identifier the provider accepts; generated names are shortened to fit.
     */
    int getMaxIdentifierLength();
}
