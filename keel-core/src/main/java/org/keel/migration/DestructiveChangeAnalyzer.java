package org.keel.migration;

import org.keel.exception.DestructiveChangeException;
import org.keel.migration.spi.dialect.Dialect;
import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.DefaultValues;

import java.util.ArrayList;
import java.util.List;

public class DestructiveChangeAnalyzer {
    private final Dialect dialect;

    public DestructiveChangeAnalyzer(Dialect dialect) {
        this.dialect = dialect;
    }

    public DestructiveChangeReport analyze(ChangeSet changeSet) {
        List<String> destructive = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (var table : changeSet.getDroppedTables()) {
            destructive.add("You are about to drop the `" + table.getTableName() + "` table, which may contain data.");
        }

        ColumnChangePolicy policy = dialect.columnChangePolicy();
        for (var altered : changeSet.getAlteredTables()) {
            String table = altered.getTableName();
            for (ColumnModel column : altered.getDroppedColumns()) {
                destructive.add("You are about to drop the column `" + column.getColumnName()
                        + "` on the `" + table + "` table, which may contain data.");
            }
            for (ChangeSet.ColumnChange change : altered.getModifiedColumns()) {
                String name = change.getNewColumn().getColumnName();
                if (policy.strategyFor(change) == ColumnChangePolicy.Strategy.DROP_AND_ADD) {
                    destructive.add("The column `" + name + "` on the `" + table + "` table changes type from "
                            + change.getOldColumn().getSqlType() + " to " + change.getNewColumn().getSqlType()
                            + " and will be dropped and recreated. Its data will be lost.");
                } else if (change.changes(ChangeSet.ColumnChange.Aspect.NULLABILITY) && !change.getNewColumn().isNullable()) {
                    warnings.add("The column `" + name + "` on the `" + table
                            + "` table becomes required. This fails if it contains NULL values.");
                }
            }
            for (ColumnModel column : altered.getAddedColumns()) {
                if (!column.isNullable() && !column.isAutoIncrement()
                        && DefaultValues.effective(column.getDefaultValue()) == null) {
                    warnings.add("Added the required column `" + column.getColumnName() + "` to the `" + table
                            + "` table without a default value. This fails if the table is not empty.");
                }
            }
        }
        return new DestructiveChangeReport(destructive, warnings);
    }

    /**
     * @throws DestructiveChangeException when the change set loses data and {@code acceptDataLoss} is off
     */
    public DestructiveChangeReport check(ChangeSet changeSet, boolean acceptDataLoss) {
        DestructiveChangeReport report = analyze(changeSet);
        if (report.isDestructive() && !acceptDataLoss) {
            throw new DestructiveChangeException(report.destructive());
        }
        return report;
    }
}
