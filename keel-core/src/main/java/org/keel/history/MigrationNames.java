package org.keel.history;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

public final class MigrationNames {

    public static final Pattern DIRECTORY_NAME = Pattern.compile("^\\d{14}_\\w+$");

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private MigrationNames() {
    }

    /**
     * {@code <yyyyMMddHHmmss>_<normalized description>}, timestamp in UTC.
     */
    public static String generate(String description, Instant now) {
        return TIMESTAMP.format(now) + "_" + normalize(description);
    }

    /**
     * Timestamp prefix of a migration directory name.
     */
    public static Instant timestampOf(String name) {
        return TIMESTAMP.parse(name.substring(0, 14), Instant::from);
    }

    public static String normalize(String description) {
        if (description == null) {
            return "migration";
        }
        String s = description.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[\\s-]", "_")
                .replaceAll("[^a-z0-9_]", "")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        return s.isEmpty() ? "migration" : s;
    }

    public static boolean isMigrationDirectory(String name) {
        return DIRECTORY_NAME.matcher(name).matches();
    }
}
