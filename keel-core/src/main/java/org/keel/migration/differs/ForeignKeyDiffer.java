package org.keel.migration.differs;

import org.keel.migration.differs.model.ForeignKeyKey;
import org.keel.model.ChangeSet;
import org.keel.model.ForeignKeyModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Foreign keys matched by {@link ForeignKeyKey}; a changed referential action is a drop plus an add.
 */
public class ForeignKeyDiffer implements TableComponentDiffer {
    private final CaseNormalizer normalizer;

    public ForeignKeyDiffer(CaseNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public void diff(TableModel oldTable, TableModel newTable, ChangeSet.AlteredTable result) {
        Map<ForeignKeyKey, ForeignKeyModel> oldByKey = new LinkedHashMap<>();
        oldTable.getForeignKeys().forEach(fk -> oldByKey.put(ForeignKeyKey.of(fk, normalizer), fk));

        for (ForeignKeyModel fk : newTable.getForeignKeys()) {
            ForeignKeyModel old = oldByKey.remove(ForeignKeyKey.of(fk, normalizer));
            if (old == null) {
                result.getAddedForeignKeys().add(fk);
            } else if (old.getOnDelete() != fk.getOnDelete() || old.getOnUpdate() != fk.getOnUpdate()) {
                result.getDroppedForeignKeys().add(old);
                result.getAddedForeignKeys().add(fk);
            }
        }
        result.getDroppedForeignKeys().addAll(oldByKey.values());
    }
}
