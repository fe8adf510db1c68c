package org.keel.migration;

import org.keel.model.ChangeSet;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-provider table deciding how a column modification is carried out. A type change is
 * done in place when the target family is listed for the source family, otherwise the
 * column is dropped and added again.
 */
public final class ColumnChangePolicy {

    public enum Strategy { ALTER_IN_PLACE, DROP_AND_ADD, REDEFINE_TABLE }

    private final Map<TypeFamily, Set<TypeFamily>> inPlace;
    private final boolean redefineTable;

    private ColumnChangePolicy(Map<TypeFamily, Set<TypeFamily>> inPlace, boolean redefineTable) {
        this.inPlace = inPlace;
        this.redefineTable = redefineTable;
    }

    /**
     * Same family or any family to text in place; numeric widening in place.
     */
    public static ColumnChangePolicy alterInPlace() {
        Map<TypeFamily, Set<TypeFamily>> table = new EnumMap<>(TypeFamily.class);
        for (TypeFamily family : TypeFamily.values()) {
            table.put(family, EnumSet.of(family, TypeFamily.TEXT));
        }
        table.get(TypeFamily.INTEGER).addAll(EnumSet.of(TypeFamily.DECIMAL, TypeFamily.FLOAT));
        table.get(TypeFamily.DECIMAL).add(TypeFamily.FLOAT);
        // OTHER covers native types we cannot classify; never assume they convert.
        table.put(TypeFamily.OTHER, EnumSet.of(TypeFamily.TEXT));
        return new ColumnChangePolicy(table, false);
    }

    /**
     * Every modification rebuilds the table.
     */
    public static ColumnChangePolicy redefining() {
        return new ColumnChangePolicy(Map.of(), true);
    }

    public Strategy strategyFor(ChangeSet.ColumnChange change) {
        if (redefineTable) {
            return Strategy.REDEFINE_TABLE;
        }
        if (!change.changes(ChangeSet.ColumnChange.Aspect.TYPE)) {
            return Strategy.ALTER_IN_PLACE;
        }
        return strategyFor(change.getOldColumn().getSqlType(), change.getNewColumn().getSqlType());
    }

    public Strategy strategyFor(String fromType, String toType) {
        if (redefineTable) {
            return Strategy.REDEFINE_TABLE;
        }
        TypeFamily from = TypeFamily.of(fromType);
        TypeFamily to = TypeFamily.of(toType);
        return inPlace.getOrDefault(from, Set.of()).contains(to) ? Strategy.ALTER_IN_PLACE : Strategy.DROP_AND_ADD;
    }

    public boolean isRedefining() {
        return redefineTable;
    }
}
