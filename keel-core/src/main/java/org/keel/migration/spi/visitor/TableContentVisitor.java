package org.keel.migration.spi.visitor;

import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.ForeignKeyModel;
import org.keel.model.IndexModel;

public interface TableContentVisitor extends SqlGeneratingVisitor {
    void visitDroppedForeignKey(ForeignKeyModel foreignKey);

    void visitDroppedIndex(IndexModel index);

    void visitDroppedPrimaryKey(ChangeSet.PrimaryKeyChange change);

    void visitDroppedColumn(ColumnModel column);

    void visitAddedColumn(ColumnModel column);

    void visitModifiedColumn(ChangeSet.ColumnChange change);

    void visitAddedPrimaryKey(ChangeSet.PrimaryKeyChange change);

    void visitAddedIndex(IndexModel index);

    void visitAddedForeignKey(ForeignKeyModel foreignKey);
}
