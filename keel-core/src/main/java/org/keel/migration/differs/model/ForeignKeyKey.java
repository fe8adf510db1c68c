package org.keel.migration.differs.model;

import org.keel.model.ForeignKeyModel;
import org.keel.model.naming.CaseNormalizer;

import java.util.List;

/**
 * Structural identity of a foreign key: local columns, referenced table and columns.
 */
public record ForeignKeyKey(List<String> columns, String referencedTable, List<String> referencedColumns) {

    public static ForeignKeyKey of(ForeignKeyModel fk, CaseNormalizer n) {
        return new ForeignKeyKey(
                fk.getColumns().stream().map(n::normalize).toList(),
                n.normalize(fk.getReferencedTable()),
                fk.getReferencedColumns().stream().map(n::normalize).toList());
    }
}
