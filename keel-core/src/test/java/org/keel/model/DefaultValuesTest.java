package org.keel.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultValuesTest {

    @Test
    @DisplayName("Raw SQL drops wrapping parentheses and repeated whitespace")
    void canonicalSql() {
        assertEquals("datetime('now')", DefaultValues.canonicalSql("(datetime('now'))"));
        assertEquals("1 + 1", DefaultValues.canonicalSql(" ((1   +\n1)) "));
        assertEquals("(a) + (b)", DefaultValues.canonicalSql("(a) + (b)"));
        assertEquals("'a  b'", DefaultValues.canonicalSql("('a  b')"));
        assertEquals("')(' || x", DefaultValues.canonicalSql("(')(' || x)"));
    }

    @Test
    @DisplayName("dbgenerated defaults compare by their canonical SQL")
    void dbGeneratedSameness() {
        String declared = "dbgenerated(\"(datetime('now'))\")";

        assertEquals("dbgenerated(\"datetime('now')\")", DefaultValues.dbGenerated("(datetime('now'))"));
        assertTrue(DefaultValues.same(declared, DefaultValues.dbGenerated("datetime('now')")));
        assertFalse(DefaultValues.same(declared, DefaultValues.dbGenerated("date('now')")));
    }

    @Test
    @DisplayName("Client-generated defaults have no database counterpart")
    void clientGenerated() {
        assertTrue(DefaultValues.same(DefaultValues.CUID, null));
        assertTrue(DefaultValues.same("1.50", "1.5"));
    }
}
