package org.keel.options;

/**
 * Defines configuration option constants used throughout Keel.
 * The CLI and the engine use the same keys and file names.
 */
public final class KeelOptions {

    private KeelOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "KEEL_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "keel.yaml";
    }

    /**
     * Declaration file settings.
     */
    public static final class Schema {
        private Schema() {}

        public static final String DEFAULT_FILE = "schema.keel";
        public static final String PATH_KEY = "keel.schema";
    }

    /**
     * Migration history layout.
     */
    public static final class Migrations {
        private Migrations() {}

        public static final String DEFAULT_DIRECTORY = "migrations";
        public static final String SQL_FILE = "migration.sql";
        public static final String LOCK_FILE = "migration_lock.toml";
        public static final String LEDGER_TABLE = "_keel_migrations";
        public static final String DIRECTORY_KEY = "keel.migrations.directory";
    }

    /**
     * Connection settings.
     */
    public static final class Datasource {
        private Datasource() {}

        public static final String URL_KEY = "keel.datasource.url";
        public static final String SHADOW_URL_KEY = "keel.datasource.shadowUrl";
    }

    /**
     * Diff settings.
     */
    public static final class Diff {
        private Diff() {}

        public static final String INDEX_COLUMN_ORDER_KEY = "keel.diff.indexColumnOrder";
    }
}
