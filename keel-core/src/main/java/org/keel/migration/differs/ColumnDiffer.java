package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Added, dropped and modified columns. A modification carries every changed aspect at once
 * and is never split into drop plus add here.
 */
public class ColumnDiffer implements TableComponentDiffer {
    private final CaseNormalizer normalizer;

    public ColumnDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel oldTable, TableModel newTable, ChangeSet.AlteredTable result) {
        Map<String, ColumnModel> oldColumns = byKey(oldTable);
        Map<String, ColumnModel> newColumns = byKey(newTable);

        newColumns.forEach((key, newColumn) -> {
            ColumnModel oldColumn = oldColumns.get(key);
            if (oldColumn == null) {
                result.getAddedColumns().add(newColumn);
                return;
            }
            Set<ChangeSet.ColumnChange.Aspect> aspects = compare(oldColumn, newColumn);
            if (!aspects.isEmpty()) {
                result.getModifiedColumns().add(ChangeSet.ColumnChange.builder()
                        .oldColumn(oldColumn)
                        .newColumn(newColumn)
                        .aspects(aspects)
                        .build());
            }
        });
        oldColumns.forEach((key, oldColumn) -> {
            if (!newColumns.containsKey(key)) {
                result.getDroppedColumns().add(oldColumn);
            }
        });
    }

    static Set<ChangeSet.ColumnChange.Aspect> compare(ColumnModel oldColumn, ColumnModel newColumn) {
        Set<ChangeSet.ColumnChange.Aspect> aspects = EnumSet.noneOf(ChangeSet.ColumnChange.Aspect.class);
        if (!sameType(oldColumn.getSqlType(), newColumn.getSqlType())) {
            aspects.add(ChangeSet.ColumnChange.Aspect.TYPE);
        }
        if (oldColumn.isNullable() != newColumn.isNullable()) {
            aspects.add(ChangeSet.ColumnChange.Aspect.NULLABILITY);
        }
        if (!DefaultValues.same(oldColumn.getDefaultValue(), newColumn.getDefaultValue())) {
            aspects.add(ChangeSet.ColumnChange.Aspect.DEFAULT);
        }
        return aspects;
    }

    static boolean sameType(String left, String right) {
        return compact(left).equals(compact(right));
    }

    private static String compact(String type) {
        return type == null ? "" : type.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    private Map<String, ColumnModel> byKey(TableModel table) {
        Map<String, ColumnModel> columns = new LinkedHashMap<>();
        table.getColumns().values().forEach(c -> columns.put(normalizer.normalize(c.getColumnName()), c));
        return columns;
    }
}
