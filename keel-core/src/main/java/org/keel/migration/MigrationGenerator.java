package org.keel.migration;

import lombok.extern.slf4j.Slf4j;
import org.keel.migration.spi.dialect.DdlDialect;
import org.keel.model.ChangeSet;
import org.keel.model.ForeignKeyModel;
import org.keel.model.TableModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a {@link ChangeSet} as one SQL script, destructive steps first:
 * foreign key and index drops, table drops, table creation, column and key alterations,
 * then foreign key additions.
 */
@Slf4j
public class MigrationGenerator {
    private final DdlDialect dialect;

    public MigrationGenerator(DdlDialect dialect) {
        this.dialect = dialect;
    }

    public String generateSql(ChangeSet changeSet) {
        if (changeSet.isEmpty()) {
            return "";
        }
        var out = new StringBuilder();

        List<ChangeSet.AlteredTable> inPlace = new ArrayList<>();
        List<ChangeSet.AlteredTable> redefined = new ArrayList<>();
        for (ChangeSet.AlteredTable altered : alterations(changeSet)) {
            if (dialect.requiresRedefinition(altered)) {
                redefined.add(altered);
            } else {
                inPlace.add(altered);
            }
        }

        List<TableModel> dropOrder = dependencyOrder(changeSet.getDroppedTables());
        Collections.reverse(dropOrder);
        List<TableModel> createOrder = dependencyOrder(changeSet.getCreatedTables());

        // 1) foreign key and index drops on surviving tables
        for (var altered : inPlace) {
            var v = new MigrationVisitor(dialect, altered);
            altered.accept(v, ChangeSet.TableContentPhase.DROP);
            append(out, v.getGeneratedSql());
        }
        // 1-1) foreign keys that would keep a dropped table alive
        if (dialect.supportsForeignKeyAlteration()) {
            append(out, dropBlockingForeignKeys(dropOrder));
        }

        // 2) table drops, dependents first
        {
            var v = new MigrationVisitor(dialect);
            dropOrder.forEach(v::visitDroppedTable);
            append(out, v.getGeneratedSql());
        }

        // 3) table creation, referenced tables first
        Map<String, List<ForeignKeyModel>> deferred = new LinkedHashMap<>();
        {
            var v = new MigrationVisitor(dialect);
            Set<String> pending = new HashSet<>();
            createOrder.forEach(t -> pending.add(t.getTableName()));
            // targets altered below may not have their referenced columns yet
            inPlace.forEach(a -> pending.add(a.getTableName()));
            for (TableModel table : createOrder) {
                List<ForeignKeyModel> inline = new ArrayList<>();
                for (ForeignKeyModel fk : table.getForeignKeys()) {
                    boolean notReady = pending.contains(fk.getReferencedTable())
                            && !fk.getReferencedTable().equals(table.getTableName());
                    if (notReady && dialect.supportsForeignKeyAlteration()) {
                        deferred.computeIfAbsent(table.getTableName(), k -> new ArrayList<>()).add(fk);
                    } else {
                        inline.add(fk);
                    }
                }
                v.visitAddedTable(table, inline);
                pending.remove(table.getTableName());
            }
            append(out, v.getGeneratedSql());
        }

        // 4) alterations: columns, primary key, new indexes
        for (var altered : inPlace) {
            var v = new MigrationVisitor(dialect, altered);
            altered.accept(v, ChangeSet.TableContentPhase.ALTER);
            append(out, v.getGeneratedSql());
        }
        for (var altered : redefined) {
            var v = new MigrationVisitor(dialect, altered);
            v.visitRedefinedTable();
            append(out, v.getGeneratedSql());
        }

        // 5) foreign key additions, including the ones deferred by cycles
        for (var altered : inPlace) {
            var v = new MigrationVisitor(dialect, altered);
            altered.accept(v, ChangeSet.TableContentPhase.FK_ADD);
            append(out, v.getGeneratedSql());
        }
        if (!deferred.isEmpty()) {
            var v = new MigrationVisitor(dialect);
            deferred.forEach((table, fks) -> fks.forEach(fk -> v.visitDeferredForeignKey(table, fk)));
            append(out, v.getGeneratedSql());
        }

        log.debug("Generated {} characters of SQL for {} created, {} altered, {} dropped tables",
                out.length(), createOrder.size(), inPlace.size() + redefined.size(), dropOrder.size());
        return out.toString().trim();
    }

    private static List<ChangeSet.AlteredTable> alterations(ChangeSet changeSet) {
        List<ChangeSet.AlteredTable> all = new ArrayList<>(changeSet.getAlteredTables());
        changeSet.getIndexChanges().forEach(ic -> all.add(ic.toAlteredTable()));
        return all;
    }

    /**
     * Foreign keys of a table dropped later that point at a table dropped earlier. Only
     * cycles produce these.
     */
    private String dropBlockingForeignKeys(List<TableModel> dropOrder) {
        var sb = new StringBuilder();
        Set<String> droppedBefore = new HashSet<>();
        List<String> names = dropOrder.stream().map(TableModel::getTableName).toList();
        for (int i = 0; i < dropOrder.size(); i++) {
            droppedBefore.add(names.get(i));
            for (int j = i + 1; j < dropOrder.size(); j++) {
                TableModel later = dropOrder.get(j);
                for (ForeignKeyModel fk : later.getForeignKeys()) {
                    if (fk.getReferencedTable().equals(names.get(i)) && fk.getConstraintName() != null) {
                        sb.append(dialect.getDropForeignKeySql(later.getTableName(), fk));
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Tables ordered so that referenced tables come before the tables referencing them.
     * Tables caught in a cycle keep their input order after every acyclic table they need.
     */
    static List<TableModel> dependencyOrder(List<TableModel> tables) {
        Map<String, TableModel> byName = new LinkedHashMap<>();
        tables.forEach(t -> byName.put(t.getTableName(), t));

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (TableModel t : tables) {
            inDegree.putIfAbsent(t.getTableName(), 0);
            for (String ref : t.getReferencedTables()) {
                if (byName.containsKey(ref)) {
                    inDegree.merge(t.getTableName(), 1, Integer::sum);
                    dependents.computeIfAbsent(ref, k -> new ArrayList<>()).add(t.getTableName());
                }
            }
        }

        List<TableModel> ordered = new ArrayList<>();
        Set<String> done = new HashSet<>();
        boolean progress = true;
        while (ordered.size() < tables.size()) {
            if (!progress) {
                // cycle: release the first remaining table in input order
                String next = byName.keySet().stream().filter(n -> !done.contains(n)).findFirst().orElseThrow();
                inDegree.put(next, 0);
            }
            progress = false;
            for (String name : byName.keySet()) {
                if (!done.contains(name) && inDegree.get(name) == 0) {
                    done.add(name);
                    ordered.add(byName.get(name));
                    dependents.getOrDefault(name, List.of()).forEach(d -> inDegree.merge(d, -1, Integer::sum));
                    progress = true;
                    break;
                }
            }
        }
        return ordered;
    }

    private static void append(StringBuilder out, String sql) {
        if (sql != null && !sql.isBlank()) {
            out.append(sql.strip()).append("\n\n");
        }
    }
}
