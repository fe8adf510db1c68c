package org.keel.migration.spi.visitor;

import org.keel.model.TableModel;

public interface TableVisitor extends SqlGeneratingVisitor {
    void visitAddedTable(TableModel table);

    void visitDroppedTable(TableModel table);
}
