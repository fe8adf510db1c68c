package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.IndexColumn;
import org.keel.model.IndexModel;
import org.keel.model.TableModel;
import org.keel.model.naming.CaseNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexDifferTest {

    private static TableModel table(IndexModel... indexes) {
        return TableModel.builder().tableName("T").indexes(new ArrayList<>(List.of(indexes))).build();
    }

    private static ChangeSet.AlteredTable diff(IndexDiffer differ, TableModel oldTable, TableModel newTable) {
        ChangeSet.AlteredTable result = ChangeSet.AlteredTable.builder().tableName("T").build();
        differ.diff(oldTable, newTable, result);
        return result;
    }

    @Test
    @DisplayName("Renamed index with the same content is not a change")
    void nameIgnored() {
        ChangeSet.AlteredTable out = diff(new IndexDiffer(CaseNormalizer.preserve(), false),
                table(IndexModel.of("old_name", false, "a", "b")),
                table(IndexModel.of("T_a_b_idx", false, "a", "b")));

        assertTrue(out.isEmpty());
    }

    @Test
    @DisplayName("Column order counts only when significant")
    void columnOrder() {
        TableModel ab = table(IndexModel.of("i", false, "a", "b"));
        TableModel ba = table(IndexModel.of("i", false, "b", "a"));

        assertTrue(diff(new IndexDiffer(CaseNormalizer.preserve(), false), ab, ba).isEmpty());

        ChangeSet.AlteredTable out = diff(new IndexDiffer(CaseNormalizer.preserve(), true), ab, ba);
        assertThat(out.getAddedIndexes()).hasSize(1);
        assertThat(out.getDroppedIndexes()).hasSize(1);
    }

    @Test
    @DisplayName("Uniqueness and sort order are part of the identity")
    void uniquenessAndSortOrder() {
        IndexModel desc = IndexModel.builder().indexName("i")
                .columns(List.of(IndexColumn.builder().columnName("a").sortOrder(IndexColumn.SortOrder.DESC).build()))
                .build();

        ChangeSet.AlteredTable unique = diff(new IndexDiffer(CaseNormalizer.preserve(), false),
                table(IndexModel.of("i", false, "a")), table(IndexModel.of("i", true, "a")));
        ChangeSet.AlteredTable sorted = diff(new IndexDiffer(CaseNormalizer.preserve(), false),
                table(IndexModel.of("i", false, "a")), table(desc));

        assertThat(unique.getAddedIndexes()).extracting(IndexModel::isUnique).containsExactly(true);
        assertThat(sorted.getDroppedIndexes()).hasSize(1);
    }

    @Test
    @DisplayName("Duplicate indexes are matched one to one")
    void duplicates() {
        ChangeSet.AlteredTable out = diff(new IndexDiffer(CaseNormalizer.lower(), false),
                table(IndexModel.of("x1", false, "A"), IndexModel.of("x2", false, "a")),
                table(IndexModel.of("y", false, "a")));

        assertThat(out.getDroppedIndexes()).extracting(IndexModel::getIndexName).containsExactly("x2");
        assertThat(out.getAddedIndexes()).isEmpty();
    }
}
