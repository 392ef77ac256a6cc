package com.connstring.sdk.unit;

import com.connstring.sdk.encoding.PercentEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the percent encoder
 */
class PercentEncoderTest {

    @Test
    void testEncodesAllReservedCharacters() {
        assertEquals(
            "%21%23%24%26%27%28%29%2A%2B%2C%2F%3A%3B%3D%3F%40%5B%5D",
            PercentEncoder.encode("!#$&'()*+,/:;=?@[]")
        );
    }

    @Test
    void testEncodesInsideText() {
        assertEquals("test%21", PercentEncoder.encode("test!"));
        assertEquals("user%40example.com", PercentEncoder.encode("user@example.com"));
        assertEquals("a%2Fb%2Fc", PercentEncoder.encode("a/b/c"));
    }

    @Test
    void testPlainValueUnchanged() {
        assertEquals("", PercentEncoder.encode(""));
        assertEquals("localhost", PercentEncoder.encode("localhost"));
        assertEquals("my-db_01.~", PercentEncoder.encode("my-db_01.~"));
    }

    @Test
    void testPercentSignIsNotEscaped() {
        assertEquals("100%", PercentEncoder.encode("100%"));
        assertEquals("%21", PercentEncoder.encode("%21"));
        assertEquals("50%25%21", PercentEncoder.encode("50%25!"));
    }

    @Test
    void testEncodingTwiceMatchesEncodingOnce() {
        String once = PercentEncoder.encode("p@ss:w/rd");
        assertEquals("p%40ss%3Aw%2Frd", once);
        assertEquals(once, PercentEncoder.encode(once));
    }

    @Test
    void testNonAsciiAndControlCharactersUnchanged() {
        assertEquals("Ünïcødé €", PercentEncoder.encode("Ünïcødé €"));
        assertEquals("\u0000\t\n", PercentEncoder.encode("\u0000\t\n"));
        assertEquals("😀%40", PercentEncoder.encode("😀@"));
        assertEquals("a b", PercentEncoder.encode("a b"));
    }

    @ParameterizedTest
    @ValueSource(chars = {'!', '#', '$', '&', '\'', '(', ')', '*', '+', ',', '/', ':', ';', '=', '?', '@', '[', ']'})
    void testReservedCharacter(char c) {
        assertTrue(PercentEncoder.isReserved(c));
        assertEquals(String.format("%%%02X", (int) c), PercentEncoder.encode(String.valueOf(c)));
    }

    @ParameterizedTest
    @ValueSource(chars = {'%', 'a', 'Z', '0', '-', '.', '_', '~', ' ', '"', '<', '>', '\\', '^', '`', '{', '|', '}', 'é'})
    void testUnreservedCharacter(char c) {
        assertFalse(PercentEncoder.isReserved(c));
        assertEquals(String.valueOf(c), PercentEncoder.encode(String.valueOf(c)));
    }

    @Test
    void testNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> PercentEncoder.encode(null));
    }
}
