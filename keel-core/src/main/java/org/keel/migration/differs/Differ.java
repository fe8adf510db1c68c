package org.keel.migration.differs;

import org.keel.model.ChangeSet;
import org.keel.model.SchemaModel;

@FunctionalInterface
public interface Differ {
    void diff(SchemaModel oldSchema, SchemaModel newSchema, ChangeSet result);
}
