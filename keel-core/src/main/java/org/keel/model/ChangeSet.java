package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import org.keel.migration.spi.visitor.TableContentVisitor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of comparing two schema models: tables to create, alter and drop, plus index-only
 * changes on tables that are otherwise identical.
 */
@Builder
@Getter
public class ChangeSet {
    @Builder.Default private List<TableModel> createdTables = new ArrayList<>();
    @Builder.Default private List<AlteredTable> alteredTables = new ArrayList<>();
    @Builder.Default private List<TableModel> droppedTables = new ArrayList<>();
    @Builder.Default private List<IndexChange> indexChanges = new ArrayList<>();
    @Builder.Default private List<String> warnings = new ArrayList<>();
    @Builder.Default private List<String> failedDiffers = new ArrayList<>();

    public enum TableContentPhase { DROP, ALTER, FK_ADD }

    public static ChangeSet empty() {
        return ChangeSet.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return createdTables.isEmpty() && alteredTables.isEmpty()
                && droppedTables.isEmpty() && indexChanges.isEmpty();
    }

    /**
     * False when a differ failed; the change set then only covers part of the difference.
     */
    @JsonIgnore
    public boolean isComplete() {
        return failedDiffers.isEmpty();
    }

    @JsonIgnore
    public List<String> getDroppedTableNames() {
        return droppedTables.stream().map(TableModel::getTableName).toList();
    }

    @JsonIgnore
    public List<String> getCreatedTableNames() {
        return createdTables.stream().map(TableModel::getTableName).toList();
    }

    public Optional<AlteredTable> findAlteredTable(String tableName) {
        return alteredTables.stream().filter(a -> a.getTableName().equals(tableName)).findFirst();
    }

    @Builder
    @Getter
    public static class AlteredTable {
        private String tableName;
        private TableModel oldTable;
        private TableModel newTable;
        @Builder.Default private List<ColumnModel> addedColumns = new ArrayList<>();
        @Builder.Default private List<ColumnModel> droppedColumns = new ArrayList<>();
        @Builder.Default private List<ColumnChange> modifiedColumns = new ArrayList<>();
        @Builder.Default private List<IndexModel> addedIndexes = new ArrayList<>();
        @Builder.Default private List<IndexModel> droppedIndexes = new ArrayList<>();
        @Builder.Default private List<ForeignKeyModel> addedForeignKeys = new ArrayList<>();
        @Builder.Default private List<ForeignKeyModel> droppedForeignKeys = new ArrayList<>();
        @Setter @Builder.Default private PrimaryKeyChange primaryKeyChange = null;

        @JsonIgnore
        public boolean isEmpty() {
            return addedColumns.isEmpty() && droppedColumns.isEmpty() && modifiedColumns.isEmpty()
                    && addedIndexes.isEmpty() && droppedIndexes.isEmpty()
                    && addedForeignKeys.isEmpty() && droppedForeignKeys.isEmpty()
                    && primaryKeyChange == null;
        }

        @JsonIgnore
        public boolean hasOnlyIndexChanges() {
            return addedColumns.isEmpty() && droppedColumns.isEmpty() && modifiedColumns.isEmpty()
                    && addedForeignKeys.isEmpty() && droppedForeignKeys.isEmpty()
                    && primaryKeyChange == null;
        }

        public void accept(TableContentVisitor v, TableContentPhase phase) {
            switch (phase) {
                case DROP -> {
                    droppedForeignKeys.forEach(v::visitDroppedForeignKey);
                    droppedIndexes.forEach(v::visitDroppedIndex);
                }
                case ALTER -> {
                    if (primaryKeyChange != null && !primaryKeyChange.getOldColumns().isEmpty()) {
                        v.visitDroppedPrimaryKey(primaryKeyChange);
                    }
                    droppedColumns.forEach(v::visitDroppedColumn);
                    addedColumns.forEach(v::visitAddedColumn);
                    modifiedColumns.forEach(v::visitModifiedColumn);
                    if (primaryKeyChange != null && !primaryKeyChange.getNewColumns().isEmpty()) {
                        v.visitAddedPrimaryKey(primaryKeyChange);
                    }
                    addedIndexes.forEach(v::visitAddedIndex);
                }
                case FK_ADD -> addedForeignKeys.forEach(v::visitAddedForeignKey);
            }
        }
    }

    @Builder
    @Getter
    public static class ColumnChange {
        public enum Aspect { TYPE, NULLABILITY, DEFAULT }

        private ColumnModel oldColumn;
        private ColumnModel newColumn;
        @Builder.Default private Set<Aspect> aspects = EnumSet.noneOf(Aspect.class);

        public boolean changes(Aspect aspect) {
            return aspects.contains(aspect);
        }

        public String describe() {
            return aspects.stream().map(a -> switch (a) {
                case TYPE -> "type " + oldColumn.getSqlType() + " -> " + newColumn.getSqlType();
                case NULLABILITY -> newColumn.isNullable() ? "made optional" : "made required";
                case DEFAULT -> "default " + oldColumn.getDefaultValue() + " -> " + newColumn.getDefaultValue();
            }).collect(Collectors.joining(", "));
        }
    }

    @Builder
    @Getter
    public static class PrimaryKeyChange {
        @Builder.Default private List<String> oldColumns = new ArrayList<>();
        @Builder.Default private List<String> newColumns = new ArrayList<>();
        private String oldConstraintName;
    }

    @Builder
    @Getter
    public static class IndexChange {
        private String tableName;
        private TableModel oldTable;
        private TableModel newTable;
        @Builder.Default private List<IndexModel> addedIndexes = new ArrayList<>();
        @Builder.Default private List<IndexModel> droppedIndexes = new ArrayList<>();

        /**
         * Same change expressed as a table alteration, for providers that must rebuild the table.
         */
        public AlteredTable toAlteredTable() {
            return AlteredTable.builder()
                    .tableName(tableName)
                    .oldTable(oldTable)
                    .newTable(newTable)
                    .addedIndexes(new ArrayList<>(addedIndexes))
                    .droppedIndexes(new ArrayList<>(droppedIndexes))
                    .build();
        }
    }
}
