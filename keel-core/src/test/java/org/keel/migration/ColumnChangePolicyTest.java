package org.keel.migration;

import org.keel.model.ChangeSet;
import org.keel.model.ColumnModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnChangePolicyTest {

    @ParameterizedTest(name = "{0} -> {1}: {2}")
    @CsvSource({
            "INTEGER, BIGINT, ALTER_IN_PLACE",
            "INT, 'DECIMAL(10,2)', ALTER_IN_PLACE",
            "'DECIMAL(65,30)', DOUBLE PRECISION, ALTER_IN_PLACE",
            "BOOLEAN, TEXT, ALTER_IN_PLACE",
            "'VARCHAR(32)', TEXT, ALTER_IN_PLACE",
            "TEXT, INTEGER, DROP_AND_ADD",
            "DOUBLE, INT, DROP_AND_ADD",
            "TIMESTAMP(3), BOOLEAN, DROP_AND_ADD",
            "TEXT[], TEXT, ALTER_IN_PLACE",
            "TEXT[], INTEGER, DROP_AND_ADD"
    })
    @DisplayName("In-place type changes follow the family table")
    void alterInPlace(String from, String to, ColumnChangePolicy.Strategy expected) {
        assertEquals(expected, ColumnChangePolicy.alterInPlace().strategyFor(from, to));
    }

    @Test
    @DisplayName("Changes that leave the type alone are always done in place")
    void nonTypeChange_inPlace() {
        ColumnModel col = ColumnModel.builder().columnName("a").sqlType("TEXT").build();
        ChangeSet.ColumnChange change = ChangeSet.ColumnChange.builder()
                .oldColumn(col)
                .newColumn(col.toBuilder().sqlType("INTEGER").isNullable(false).build())
                .aspects(EnumSet.of(ChangeSet.ColumnChange.Aspect.NULLABILITY))
                .build();

        assertEquals(ColumnChangePolicy.Strategy.ALTER_IN_PLACE, ColumnChangePolicy.alterInPlace().strategyFor(change));
    }

    @Test
    @DisplayName("A redefining policy rebuilds the table for everything")
    void redefining() {
        ColumnChangePolicy policy = ColumnChangePolicy.redefining();

        assertTrue(policy.isRedefining());
        assertEquals(ColumnChangePolicy.Strategy.REDEFINE_TABLE, policy.strategyFor("INTEGER", "BIGINT"));
    }

    @Test
    @DisplayName("Type families")
    void typeFamilies() {
        assertEquals(TypeFamily.BOOLEAN, TypeFamily.of("tinyint(1)"));
        assertEquals(TypeFamily.INTEGER, TypeFamily.of("TINYINT(4)"));
        assertEquals(TypeFamily.INTEGER, TypeFamily.of("INT(10) UNSIGNED"));
        assertEquals(TypeFamily.DATETIME, TypeFamily.of("TIMESTAMPTZ(6)"));
        assertEquals(TypeFamily.OTHER, TypeFamily.of("INTEGER[]"));
        assertEquals(TypeFamily.OTHER, TypeFamily.of(null));
    }
}
