package dev.mars.pgq.api.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class PostgreSqlIdentifierValidatorTest {

    @Test
    void testValidNames() {
        assertTrue(PostgreSqlIdentifierValidator.isValid("valid_queue"));
        assertTrue(PostgreSqlIdentifierValidator.isValid("queue123"));
        assertTrue(PostgreSqlIdentifierValidator.isValid("_queue"));
        assertTrue(PostgreSqlIdentifierValidator.isValid("Queue"));
        assertTrue(PostgreSqlIdentifierValidator.isValid("a".repeat(63)));
    }

    @Test
    void testInvalidNames() {
        assertFalse(PostgreSqlIdentifierValidator.isValid(null));
        assertFalse(PostgreSqlIdentifierValidator.isValid(""));
        assertFalse(PostgreSqlIdentifierValidator.isValid("123queue"));
        assertFalse(PostgreSqlIdentifierValidator.isValid("-queue"));
        assertFalse(PostgreSqlIdentifierValidator.isValid("a".repeat(64)));
    }

    @Test
    void testLengthIsMeasuredInBytes() {
        // 32 two-byte characters are 64 bytes
        String name = "q" + "é".repeat(31);
        assertEquals(63, PostgreSqlIdentifierValidator.byteLength(name));
        assertTrue(PostgreSqlIdentifierValidator.isValid(name));
        assertFalse(PostgreSqlIdentifierValidator.isValid(name + "x"));
    }

    @Test
    void testValidateThrowsWithIdentifierType() {
        IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
            () -> PostgreSqlIdentifierValidator.validate("", "queue"));
        assertTrue(empty.getMessage().contains("queue"));

        IllegalArgumentException tooLong = assertThrows(IllegalArgumentException.class,
            () -> PostgreSqlIdentifierValidator.validate("a".repeat(64), "schema"));
        assertTrue(tooLong.getMessage().contains("63"));

        assertThrows(IllegalArgumentException.class,
            () -> PostgreSqlIdentifierValidator.validate("9lives", "queue"));
        assertDoesNotThrow(() -> PostgreSqlIdentifierValidator.validate("orders", "queue"));
    }

    @Test
    void testQuote() {
        assertEquals("\"orders\"", PostgreSqlIdentifierValidator.quote("orders"));
        assertEquals("\"Mixed\"", PostgreSqlIdentifierValidator.quote("Mixed"));
        assertEquals("\"a\"\"b\"", PostgreSqlIdentifierValidator.quote("a\"b"));
        assertEquals("\"ab\"", PostgreSqlIdentifierValidator.quote("a\u0000b"));
    }

    @Test
    void testTruncateToBytesKeepsWholeCharacters() {
        assertEquals("abc", PostgreSqlIdentifierValidator.truncateToBytes("abc", 10));
        assertEquals("ab", PostgreSqlIdentifierValidator.truncateToBytes("abc", 2));
        // each é is two bytes; three bytes only fits one of them
        assertEquals("é", PostgreSqlIdentifierValidator.truncateToBytes("éé", 3));
    }
}
