package org.keel.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * {@code <table>_<columns>_<suffix>} names, shortened with a hash when they exceed the
 * provider's identifier limit. Column order is kept as declared.
 */
public class DefaultNaming implements Naming {
    private final int maxLength;

    public DefaultNaming(int maxNameLength) {
        this.maxLength = maxNameLength;
    }

    @Override
    public String primaryKeyName(String tableName) {
        return clampWithHash(tableName + "_pkey");
    }

    @Override
    public String uniqueIndexName(String tableName, List<String> columns) {
        return buildNameWithColumns(tableName, columns, "_key");
    }

    @Override
    public String indexName(String tableName, List<String> columns) {
        return buildNameWithColumns(tableName, columns, "_idx");
    }

    @Override
    public String foreignKeyName(String tableName, List<String> columns) {
        return buildNameWithColumns(tableName, columns, "_fkey");
    }

    private String buildNameWithColumns(String table, List<String> cols, String suffix) {
        String base = table + "_" + String.join("_", cols);
        if (base.length() + suffix.length() <= maxLength) {
            return base + suffix;
        }
        return clampWithHash(base, suffix);
    }

    private String clampWithHash(String name) {
        return name.length() <= maxLength ? name : clampWithHash(name, "");
    }

    // [prefix]_[hash][suffix], still within the limit
    private String clampWithHash(String base, String suffix) {
        String hash = computeStableHash(base + suffix);
        int keep = Math.max(1, maxLength - (hash.length() + 1) - suffix.length());
        return base.substring(0, Math.min(keep, base.length())) + "_" + hash + suffix;
    }

    /**
     * First four bytes of the SHA-256 digest, hex encoded.
     */
    private String computeStableHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return String.format("%02x%02x%02x%02x", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(input.hashCode());
        }
    }
}
