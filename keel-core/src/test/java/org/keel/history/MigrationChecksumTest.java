package org.keel.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class MigrationChecksumTest {

    @Test
    @DisplayName("SHA-256 hex of the script")
    void sha256() {
        // sha256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", MigrationChecksum.compute("abc"));
    }

    @Test
    @DisplayName("Line endings and trailing blanks do not change the checksum")
    void insensitiveToWhitespaceNoise() {
        String lf = "CREATE TABLE a (id INT);\nDROP TABLE b;\n";

        assertEquals(MigrationChecksum.compute(lf), MigrationChecksum.compute("CREATE TABLE a (id INT);  \r\nDROP TABLE b;\t\r\n"));
    }

    @Test
    @DisplayName("Any content change changes the checksum")
    void sensitiveToContent() {
        assertNotEquals(MigrationChecksum.compute("DROP TABLE a;\n"), MigrationChecksum.compute("DROP TABLE b;\n"));
        assertNotEquals(MigrationChecksum.compute("DROP TABLE a;"), MigrationChecksum.compute("DROP TABLE a;\n"));
    }
}
