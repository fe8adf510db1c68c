package org.keel.migration.differs.model;

import org.keel.model.IndexColumn;
import org.keel.model.IndexModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Content identity of an index: its columns (with sort order and function) and uniqueness.
 * Names never take part.
 */
public record IndexKey(List<String> keyCols, boolean unique) {

    public static IndexKey of(IndexModel idx, CaseNormalizer n, boolean columnOrderSignificant) {
        Objects.requireNonNull(idx, "IndexModel must not be null");
        List<String> cols = idx.getColumns().stream()
                .map(c -> canonical(c, n))
                .toList();
        if (!columnOrderSignificant) {
            cols = cols.stream().sorted().toList();
        }
        return new IndexKey(cols, idx.isUnique());
    }

    private static String canonical(IndexColumn c, CaseNormalizer n) {
        StringBuilder sb = new StringBuilder(n.normalize(c.getColumnName()));
        if (c.getFunction() != null) {
            sb.insert(0, c.getFunction().toLowerCase(Locale.ROOT) + "(").append(")");
        }
        if (c.getSortOrder() == IndexColumn.SortOrder.DESC) {
            sb.append(" desc");
        }
        return sb.toString();
    }
}
