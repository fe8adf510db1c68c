package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Column reference inside an index, optionally with a sort order or a function wrapper
 * such as {@code lower(email)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexColumn {
    private String columnName;
    @Builder.Default private SortOrder sortOrder = null;
    @Builder.Default private String function = null;

    public enum SortOrder { ASC, DESC }

    public static IndexColumn of(String columnName) {
        return IndexColumn.builder().columnName(columnName).build();
    }

    @JsonIgnore
    public boolean isPlain() {
        return function == null && sortOrder != SortOrder.DESC;
    }
}
