package org.keel.naming;

import java.util.List;

/**
 * Default names for constraints and indexes that the declaration does not name explicitly.
 */
public interface Naming {
    String primaryKeyName(String tableName);
    String uniqueIndexName(String tableName, List<String> columns);
    String indexName(String tableName, List<String> columns);
    String foreignKeyName(String tableName, List<String> columns);
}
