package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.TableModel;

@FunctionalInterface
public interface TableComponentDiffer {
    void diff(TableModel oldTable, TableModel newTable, ChangeSet.AlteredTable result);
}
