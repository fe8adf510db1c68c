package org.keel.migration.differs;

import org.keel.migration.differs.model.IndexKey;
import org.keel.model.ChangeSet;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Matches indexes by {@link IndexKey}. Generated names differ between a declaration and a
 * live database, so an index that only changed its name is left alone.
 */
public class IndexDiffer implements TableComponentDiffer {

    private final CaseNormalizer normalizer;
    private final boolean columnOrderSignificant;

    public IndexDiffer(CaseNormalizer normalizer, boolean columnOrderSignificant) {
        this.normalizer = normalizer;
        this.columnOrderSignificant = columnOrderSignificant;
    }

    @Override
    public void diff(TableModel oldTable, TableModel newTable, ChangeSet.AlteredTable result) {
        Map<IndexKey, Deque<IndexModel>> oldByKey = new LinkedHashMap<>();
        for (IndexModel idx : oldTable.getIndexes()) {
            oldByKey.computeIfAbsent(key(idx), k -> new ArrayDeque<>()).add(idx);
        }

        for (IndexModel idx : newTable.getIndexes()) {
            Deque<IndexModel> candidates = oldByKey.get(key(idx));
            if (candidates == null || candidates.isEmpty()) {
                result.getAddedIndexes().add(idx);
            } else {
                candidates.poll();
            }
        }
        oldByKey.values().forEach(result.getDroppedIndexes()::addAll);
    }

    private IndexKey key(IndexModel idx) {
        return IndexKey.of(idx, normalizer, columnOrderSignificant);
    }
}
