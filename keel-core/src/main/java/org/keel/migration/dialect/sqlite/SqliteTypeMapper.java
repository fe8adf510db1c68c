package org.keel.migration.dialect.sqlite;

import org.keel.migration.spi.TypeMapper;
import org.keel.parser.ast.ScalarType;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class SqliteTypeMapper implements TypeMapper {

    private static final Map<ScalarType, String> SCALARS = new EnumMap<>(Map.of(
            ScalarType.STRING, "TEXT",
            ScalarType.INT, "INTEGER",
            ScalarType.BIGINT, "INTEGER",
            ScalarType.FLOAT, "REAL",
            ScalarType.DECIMAL, "DECIMAL",
            ScalarType.BOOLEAN, "BOOLEAN",
            ScalarType.DATETIME, "DATETIME",
            ScalarType.JSON, "TEXT",
            ScalarType.BYTES, "BLOB"
    ));

    @Override
    public String map(ScalarType scalar, boolean list) {
        if (list) {
            throw new IllegalArgumentException("SQLite has no scalar list columns");
        }
        return SCALARS.get(scalar);
    }

    // SQLite has no native type attributes
    @Override
    public Optional<String> mapNative(String nativeName, List<String> arguments) {
        return Optional.empty();
    }

    @Override
    public String normalize(String catalogType) {
        return catalogType.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @Override
    public boolean supportsScalarLists() {
        return false;
    }
}
