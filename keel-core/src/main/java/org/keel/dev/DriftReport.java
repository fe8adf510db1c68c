package org.keel.dev;

import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.keel.model.IndexModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable summary of how the live database differs from what the applied migrations
 * would produce. Read as the changes leading from the expected schema to the actual one.
 */
public record DriftReport(ChangeSet changes) {

    public boolean hasDrift() {
        return !changes.isEmpty();
    }

    public String render() {
        List<String> sections = new ArrayList<>();

        if (!changes.getCreatedTables().isEmpty()) {
            StringBuilder sb = new StringBuilder("[+] Added tables");
            changes.getCreatedTables().forEach(t -> sb.append("\n  - ").append(t.getTableName()));
            sections.add(sb.toString());
        }
        if (!changes.getDroppedTables().isEmpty()) {
            StringBuilder sb = new StringBuilder("[-] Removed tables");
            changes.getDroppedTables().forEach(t -> sb.append("\n  - ").append(t.getTableName()));
            sections.add(sb.toString());
        }
        for (ChangeSet.AlteredTable altered : changes.getAlteredTables()) {
            StringBuilder sb = new StringBuilder("[*] Changed the `").append(altered.getTableName()).append("` table");
            for (ColumnModel c : altered.getAddedColumns()) {
                sb.append("\n  [+] Added column `").append(c.getColumnName()).append('`');
            }
            for (ColumnModel c : altered.getDroppedColumns()) {
                sb.append("\n  [-] Removed column `").append(c.getColumnName()).append('`');
            }
            for (ChangeSet.ColumnChange c : altered.getModifiedColumns()) {
                sb.append("\n  [*] Altered column `").append(c.getNewColumn().getColumnName())
                        .append("` (").append(c.describe()).append(')');
            }
            if (altered.getPrimaryKeyChange() != null) {
                sb.append("\n  [*] Changed the primary key");
            }
            appendIndexes(sb, altered.getAddedIndexes(), altered.getDroppedIndexes());
            altered.getAddedForeignKeys().forEach(fk ->
                    sb.append("\n  [+] Added foreign key on columns (").append(String.join(", ", fk.getColumns())).append(')'));
            altered.getDroppedForeignKeys().forEach(fk ->
                    sb.append("\n  [-] Removed foreign key on columns (").append(String.join(", ", fk.getColumns())).append(')'));
            sections.add(sb.toString());
        }
        for (ChangeSet.IndexChange ic : changes.getIndexChanges()) {
            StringBuilder sb = new StringBuilder("[*] Changed the `").append(ic.getTableName()).append("` table");
            appendIndexes(sb, ic.getAddedIndexes(), ic.getDroppedIndexes());
            sections.add(sb.toString());
        }
        return String.join("\n\n", sections);
    }

    private static void appendIndexes(StringBuilder sb, List<IndexModel> added, List<IndexModel> dropped) {
        for (IndexModel idx : added) {
            sb.append("\n  [+] Added ").append(idx.isUnique() ? "unique index" : "index")
                    .append(" on columns (").append(String.join(", ", idx.getColumnNames())).append(')');
        }
        for (IndexModel idx : dropped) {
            sb.append("\n  [-] Removed ").append(idx.isUnique() ? "unique index" : "index")
                    .append(" on columns (").append(String.join(", ", idx.getColumnNames())).append(')');
        }
    }

}
