package org.keel.history;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 of a migration script, insensitive to line endings and trailing whitespace.
 */
public final class MigrationChecksum {

    private MigrationChecksum() {
    }

    public static String compute(String sql) {
        String normalized = sql.replace("\r\n", "\n").replace('\r', '\n')
                .lines()
                .map(MigrationChecksum::stripTrailing)
                .reduce((a, b) -> a + "\n" + b)
                .orElse("");
        if (sql.endsWith("\n") || sql.endsWith("\r")) {
            normalized += "\n";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }
}
