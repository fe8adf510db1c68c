package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Created and dropped tables, matched by provider-normalized name. A rename shows up as a
 * drop plus a create.
 */
public class TableDiffer implements Differ {
    private final CaseNormalizer normalizer;

    public TableDiffer(CaseNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    @Override
    public void diff(SchemaModel oldSchema, SchemaModel newSchema, ChangeSet result) {
        Map<String, TableModel> oldTables = byKey(oldSchema, normalizer);
        Map<String, TableModel> newTables = byKey(newSchema, normalizer);

        newTables.forEach((key, table) -> {
            if (!oldTables.containsKey(key)) {
                result.getCreatedTables().add(table);
            }
        });
        oldTables.forEach((key, table) -> {
            if (!newTables.containsKey(key)) {
                result.getDroppedTables().add(table);
            }
        });
    }

    static Map<String, TableModel> byKey(SchemaModel schema, CaseNormalizer normalizer) {
        Map<String, TableModel> tables = new LinkedHashMap<>();
        schema.getTables().values().forEach(t -> tables.put(normalizer.normalize(t.getTableName()), t));
        return tables;
    }
}
