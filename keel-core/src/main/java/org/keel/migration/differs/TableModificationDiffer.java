package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.List;
import java.util.Map;

/**
 * Compares tables present on both sides. Tables whose only difference is their index set are
 * reported as index changes rather than alterations.
 */
public class TableModificationDiffer implements Differ {
    private final CaseNormalizer normalizer;
    private final List<TableComponentDiffer> componentDiffers;

    public TableModificationDiffer(CaseNormalizer normalizer, boolean indexColumnOrderSignificant) {
        this.normalizer = normalizer;
        this.componentDiffers = List.of(
                new ColumnDiffer(normalizer),
                new PrimaryKeyDiffer(normalizer),
                new IndexDiffer(normalizer, indexColumnOrderSignificant),
                new ForeignKeyDiffer(normalizer)
        );
    }

    @Override
    public void diff(SchemaModel oldSchema, SchemaModel newSchema, ChangeSet result) {
        Map<String, TableModel> oldTables = TableDiffer.byKey(oldSchema, normalizer);
        TableDiffer.byKey(newSchema, normalizer).forEach((key, newTable) -> {
            TableModel oldTable = oldTables.get(key);
            if (oldTable != null) {
                diffPair(oldTable, newTable, result);
            }
        });
    }

    public void diffPair(TableModel oldTable, TableModel newTable, ChangeSet result) {
        ChangeSet.AlteredTable altered = ChangeSet.AlteredTable.builder()
                .tableName(newTable.getTableName())
                .oldTable(oldTable)
                .newTable(newTable)
                .build();

        for (TableComponentDiffer differ : componentDiffers) {
            try {
                differ.diff(oldTable, newTable, altered);
            } catch (Exception e) {
                result.getWarnings().add("Differ failed: " + differ.getClass().getSimpleName()
                        + " on table " + newTable.getTableName() + " - " + e.getMessage());
            }
        }

        if (altered.isEmpty()) {
            return;
        }
        if (altered.hasOnlyIndexChanges()) {
            result.getIndexChanges().add(ChangeSet.IndexChange.builder()
                    .tableName(newTable.getTableName())
                    .oldTable(oldTable)
                    .newTable(newTable)
                    .addedIndexes(altered.getAddedIndexes())
                    .droppedIndexes(altered.getDroppedIndexes())
                    .build());
        } else {
            result.getAlteredTables().add(altered);
        }
    }
}
