package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-agnostic snapshot of a database structure: table name to table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaModel {
    @Builder.Default
    private Map<String, TableModel> tables = new LinkedHashMap<>();

    public static SchemaModel empty() {
        return SchemaModel.builder().build();
    }

    public SchemaModel addTable(TableModel table) {
        tables.put(table.getTableName(), table);
        return this;
    }

    public Optional<TableModel> findTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tables.isEmpty();
    }
}
