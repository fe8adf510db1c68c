package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexModel {
    private String indexName;
    @Builder.Default private List<IndexColumn> columns = new ArrayList<>();
    @Builder.Default
    @JsonProperty("unique")
    private boolean isUnique = false;
    /** Backed by a table constraint rather than a free-standing index. */
    @Builder.Default private boolean constraintBacked = false;

    public static IndexModel of(String name, boolean unique, String... columnNames) {
        List<IndexColumn> cols = new ArrayList<>();
        for (String c : columnNames) {
            cols.add(IndexColumn.of(c));
        }
        return IndexModel.builder().indexName(name).isUnique(unique).columns(cols).build();
    }

    @JsonIgnore
    public List<String> getColumnNames() {
        return columns.stream().map(IndexColumn::getColumnName).toList();
    }

    /**
     * True for a unique index over exactly {@code columnName}.
     */
    public boolean isSingleColumnUniqueOn(String columnName) {
        return isUnique && columns.size() == 1
                && columns.get(0).getColumnName().equals(columnName)
                && columns.get(0).isPlain();
    }
}
