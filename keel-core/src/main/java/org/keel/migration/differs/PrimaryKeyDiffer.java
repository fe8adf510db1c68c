package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Primary key column lists compared in order. Constraint names are not compared.
 */
public class PrimaryKeyDiffer implements TableComponentDiffer {
    private final CaseNormalizer normalizer;

    public PrimaryKeyDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel oldTable, TableModel newTable, ChangeSet.AlteredTable result) {
        List<String> oldPk = oldTable.getPrimaryKey();
        List<String> newPk = newTable.getPrimaryKey();
        if (normalized(oldPk).equals(normalized(newPk))) {
            return;
        }
        result.setPrimaryKeyChange(ChangeSet.PrimaryKeyChange.builder()
                .oldColumns(new ArrayList<>(oldPk))
                .newColumns(new ArrayList<>(newPk))
                .oldConstraintName(oldTable.getPrimaryKeyName())
                .build());
    }

    private List<String> normalized(List<String> columns) {
        return columns.stream().map(normalizer::normalize).toList();
    }
}
