package org.keel.migration.contributor;

public interface SqlContributor {
    int REDEFINE_TABLE = 10;
    int DROP_TABLE = 10;
    int DROP_PRIMARY_KEY = 10;
    /** Foreign keys go before the indexes they may rely on. */
    int DROP_FOREIGN_KEY = 20;
    int DROP_COLUMN = 20;
    int DROP_INDEX = 30;
    int ADD_COLUMN = 40;
    int MODIFY_COLUMN = 50;
    int ADD_PRIMARY_KEY = 55;
    int ADD_INDEX = 60;
    int ADD_FOREIGN_KEY = 60;

    /**
     * Lower values are rendered first within one builder.
     */
    int priority();
}
