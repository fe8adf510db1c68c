package org.keel.options;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Explicit settings for one engine call. Nothing in the engine reads process-wide state.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class EngineOptions {

    /** Allow change sets that drop tables, columns or data. */
    @Builder.Default private final boolean acceptDataLoss = false;

    /** Write the migration file without applying it. */
    @Builder.Default private final boolean createOnly = false;

    /** Description used for a newly created migration. */
    @Builder.Default private final String migrationName = null;

    /** Database used to replay migrations for drift detection (PostgreSQL / MySQL). */
    @ToString.Exclude
    @Builder.Default private final String shadowDatabaseUrl = null;

    @Builder.Default private final IndexColumnOrder indexColumnOrder = IndexColumnOrder.PROVIDER_DEFAULT;

    public static EngineOptions defaults() {
        return EngineOptions.builder().build();
    }

    /**
     * Whether two indexes over the same columns in a different order are different indexes.
     */
    public enum IndexColumnOrder {
        PROVIDER_DEFAULT, SIGNIFICANT, IGNORED;

        public boolean resolve(boolean providerDefault) {
            return switch (this) {
                case PROVIDER_DEFAULT -> providerDefault;
                case SIGNIFICANT -> true;
                case IGNORED -> false;
            };
        }

        public static IndexColumnOrder fromConfig(String value) {
            if (value == null || value.isBlank()) {
                return PROVIDER_DEFAULT;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "provider", "provider_default" -> PROVIDER_DEFAULT;
                case "significant" -> SIGNIFICANT;
                case "ignored" -> IGNORED;
                default -> throw new IllegalArgumentException("Unknown index column order: " + value);
            };
        }
    }
}
