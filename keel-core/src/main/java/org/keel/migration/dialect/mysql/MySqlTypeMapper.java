package org.keel.migration.dialect.mysql;

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

public class MySqlTypeMapper implements TypeMapper {

    private static final Map<ScalarType, String> SCALARS = new EnumMap<>(Map.of(
            ScalarType.STRING, "VARCHAR(255)",
            ScalarType.INT, "INT",
            ScalarType.BIGINT, "BIGINT",
            ScalarType.FLOAT, "DOUBLE",
            ScalarType.DECIMAL, "DECIMAL(65,30)",
            ScalarType.BOOLEAN, "TINYINT(1)",
            ScalarType.DATETIME, "DATETIME(3)",
            ScalarType.JSON, "JSON",
            ScalarType.BYTES, "LONGBLOB"
    ));

    private static final Map<String, String> NATIVE = Map.ofEntries(
            entry("VarChar", "VARCHAR"),
            entry("Char", "CHAR"),
            entry("Text", "TEXT"),
            entry("TinyText", "TINYTEXT"),
            entry("MediumText", "MEDIUMTEXT"),
            entry("LongText", "LONGTEXT"),
            entry("TinyInt", "TINYINT"),
            entry("SmallInt", "SMALLINT"),
            entry("MediumInt", "MEDIUMINT"),
            entry("Int", "INT"),
            entry("BigInt", "BIGINT"),
            entry("UnsignedTinyInt", "TINYINT UNSIGNED"),
            entry("UnsignedSmallInt", "SMALLINT UNSIGNED"),
            entry("UnsignedMediumInt", "MEDIUMINT UNSIGNED"),
            entry("UnsignedInt", "INT UNSIGNED"),
            entry("UnsignedBigInt", "BIGINT UNSIGNED"),
            entry("Float", "FLOAT"),
            entry("Double", "DOUBLE"),
            entry("Decimal", "DECIMAL"),
            entry("Bit", "BIT"),
            entry("Date", "DATE"),
            entry("Time", "TIME"),
            entry("DateTime", "DATETIME"),
            entry("Timestamp", "TIMESTAMP"),
            entry("Year", "YEAR"),
            entry("Json", "JSON"),
            entry("Binary", "BINARY"),
            entry("VarBinary", "VARBINARY"),
            entry("TinyBlob", "TINYBLOB"),
            entry("Blob", "BLOB"),
            entry("MediumBlob", "MEDIUMBLOB"),
            entry("LongBlob", "LONGBLOB")
    );

    private static final Pattern DISPLAY_WIDTH =
            Pattern.compile("^(TINYINT|SMALLINT|MEDIUMINT|INT|BIGINT)\\(\\d+\\)(.*)$");

    @Override
    public String map(ScalarType scalar, boolean list) {
        if (list) {
            throw new IllegalArgumentException("MySQL has no scalar list columns");
        }
        return SCALARS.get(scalar);
    }

    @Override
    public Optional<String> mapNative(String nativeName, List<String> arguments) {
        String base = NATIVE.get(nativeName);
        if (base == null) {
            return Optional.empty();
        }
        if (arguments.isEmpty()) {
            return Optional.of(base);
        }
        // UNSIGNED goes after the length
        int space = base.indexOf(' ');
        String args = "(" + String.join(",", arguments) + ")";
        return Optional.of(space < 0 ? base + args : base.substring(0, space) + args + base.substring(space));
    }

    /**
     * Upper-cases {@code COLUMN_TYPE} and drops integer display widths, except
     * {@code TINYINT(1)} which is the boolean type.
     */
    @Override
    public String normalize(String catalogType) {
        String t = catalogType.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (t.startsWith("TINYINT(1)")) {
            return t;
        }
        Matcher m = DISPLAY_WIDTH.matcher(t);
        return m.matches() ? m.group(1) + m.group(2) : t;
    }

    @Override
    public boolean supportsScalarLists() {
        return false;
    }
}
