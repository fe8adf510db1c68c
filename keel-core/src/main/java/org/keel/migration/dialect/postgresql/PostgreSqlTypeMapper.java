package org.keel.migration.dialect.postgresql;

import org.keel.migration.spi.TypeMapper;
import org.keel.parser.ast.ScalarType;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

public class PostgreSqlTypeMapper implements TypeMapper {

    private static final Map<ScalarType, String> SCALARS = new EnumMap<>(Map.of(
            ScalarType.STRING, "TEXT",
            ScalarType.INT, "INTEGER",
            ScalarType.BIGINT, "BIGINT",
            ScalarType.FLOAT, "DOUBLE PRECISION",
            ScalarType.DECIMAL, "DECIMAL(65,30)",
            ScalarType.BOOLEAN, "BOOLEAN",
            ScalarType.DATETIME, "TIMESTAMP(3)",
            ScalarType.JSON, "JSONB",
            ScalarType.BYTES, "BYTEA"
    ));

    private static final Map<String, String> NATIVE = Map.ofEntries(
            entry("Text", "TEXT"),
            entry("VarChar", "VARCHAR"),
            entry("Char", "CHAR"),
            entry("Citext", "CITEXT"),
            entry("Uuid", "UUID"),
            entry("Inet", "INET"),
            entry("Xml", "XML"),
            entry("SmallInt", "SMALLINT"),
            entry("Integer", "INTEGER"),
            entry("BigInt", "BIGINT"),
            entry("Oid", "OID"),
            entry("Real", "REAL"),
            entry("DoublePrecision", "DOUBLE PRECISION"),
            entry("Decimal", "DECIMAL"),
            entry("Money", "MONEY"),
            entry("Boolean", "BOOLEAN"),
            entry("Bit", "BIT"),
            entry("VarBit", "VARBIT"),
            entry("Timestamp", "TIMESTAMP"),
            entry("Timestamptz", "TIMESTAMPTZ"),
            entry("Date", "DATE"),
            entry("Time", "TIME"),
            entry("Timetz", "TIMETZ"),
            entry("Json", "JSON"),
            entry("JsonB", "JSONB"),
            entry("ByteA", "BYTEA")
    );

    private static final Pattern TEMPORAL =
            Pattern.compile("^(timestamp|time)(\\(\\d+\\))? (with|without) time zone$");

    @Override
    public String map(ScalarType scalar, boolean list) {
        String type = SCALARS.get(scalar);
        return list ? type + "[]" : type;
    }

    @Override
    public Optional<String> mapNative(String nativeName, List<String> arguments) {
        String base = NATIVE.get(nativeName);
        if (base == null) {
            return Optional.empty();
        }
        return Optional.of(arguments.isEmpty() ? base : base + "(" + String.join(",", arguments) + ")");
    }

    /**
     * Folds {@code format_type} output into canonical spelling, e.g.
     * {@code character varying(32)} to {@code VARCHAR(32)}.
     */
    @Override
    public String normalize(String catalogType) {
        String t = catalogType.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        String suffix = "";
        while (t.endsWith("[]")) {
            suffix += "[]";
            t = t.substring(0, t.length() - 2);
        }
        Matcher temporal = TEMPORAL.matcher(t);
        String result;
        if (temporal.matches()) {
            String precision = temporal.group(2) != null ? temporal.group(2) : "";
            boolean zoned = temporal.group(3).equals("with");
            result = (temporal.group(1).equals("timestamp") ? "TIMESTAMP" : "TIME") + (zoned ? "TZ" : "") + precision;
        } else if (t.startsWith("character varying")) {
            result = "VARCHAR" + t.substring("character varying".length());
        } else if (t.startsWith("character")) {
            result = "CHAR" + t.substring("character".length());
        } else if (t.startsWith("numeric")) {
            result = "DECIMAL" + t.substring("numeric".length());
        } else if (t.startsWith("bit varying")) {
            result = "VARBIT" + t.substring("bit varying".length());
        } else {
            result = t;
        }
        return result.toUpperCase(Locale.ROOT).replace(" (", "(") + suffix;
    }

    @Override
    public boolean supportsScalarLists() {
        return true;
    }
}
