package org.keel.model;

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
public class ForeignKeyModel {
    /** Null when the provider does not name constraints (SQLite). */
    private String constraintName;
    @Builder.Default private List<String> columns = new ArrayList<>();
    private String referencedTable;
    @Builder.Default private List<String> referencedColumns = new ArrayList<>();
    @Builder.Default private ReferentialAction onDelete = ReferentialAction.RESTRICT;
    @Builder.Default private ReferentialAction onUpdate = ReferentialAction.CASCADE;
}
