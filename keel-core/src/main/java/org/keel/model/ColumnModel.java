package org.keel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColumnModel {
    private String columnName;
    /** Canonical SQL type, e.g. {@code TEXT}, {@code VARCHAR(255)}. */
    private String sqlType;
    @Builder.Default
    @JsonProperty("nullable")
    private boolean isNullable = true;
    @Builder.Default
    @JsonProperty("primaryKey")
    private boolean isPrimaryKey = false;
    @Builder.Default
    @JsonProperty("unique")
    private boolean isUnique = false;
    /** Canonical default expression, see {@link DefaultValues}. */
    @Builder.Default private String defaultValue = null;

    @JsonIgnore
    public boolean isAutoIncrement() {
        return DefaultValues.isAutoIncrement(defaultValue);
    }
}
