package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableModel {
    private String tableName;
    @Builder.Default private Map<String, ColumnModel> columns = new LinkedHashMap<>();
    @Builder.Default private List<IndexModel> indexes = new ArrayList<>();
    @Builder.Default private List<ForeignKeyModel> foreignKeys = new ArrayList<>();
    @Builder.Default private List<String> primaryKey = new ArrayList<>();
    @Builder.Default private String primaryKeyName = null;

    public TableModel addColumn(ColumnModel column) {
        columns.put(column.getColumnName(), column);
        return this;
    }

    public Optional<ColumnModel> findColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    @JsonIgnore
    public List<ColumnModel> getColumnList() {
        return List.copyOf(columns.values());
    }

    /**
     * Tables this one points at through foreign keys, itself excluded.
     */
    @JsonIgnore
    public List<String> getReferencedTables() {
        return foreignKeys.stream()
                .map(ForeignKeyModel::getReferencedTable)
                .filter(t -> !t.equals(tableName))
                .distinct()
                .toList();
    }
}
