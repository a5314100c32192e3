package io.rockmap.core.stream;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BoundTest {

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void successorIncrementsLastByte() {
        assertArrayEquals(b("ab"), Bound.successor(b("aa")));
        assertArrayEquals(new byte[] {0x01, 0x02}, Bound.successor(new byte[] {0x01, 0x01}));
    }

    @Test
    void successorDropsTrailingFfBytes() {
        assertArrayEquals(new byte[] {0x02}, Bound.successor(new byte[] {0x01, (byte) 0xFF, (byte) 0xFF}));
        assertNull(Bound.successor(new byte[] {(byte) 0xFF, (byte) 0xFF}));
    }

    @Test
    void prefixBoundRange() {
        Bound bound = Bound.prefix(b("user:"));
        assertArrayEquals(b("user:"), bound.lower());
        assertArrayEquals(b("user;"), bound.upper());
        assertNull(bound.start());
        assertTrue(bound.contains(b("user:1")));
        assertTrue(bound.contains(b("user:")));
        assertFalse(bound.contains(b("user")));
        assertFalse(bound.contains(b("users")));
    }

    @Test
    void fromBoundOnlySetsStart() {
        byte[] key = b("k");
        Bound bound = Bound.from(key);
        key[0] = 'z';
        assertArrayEquals(b("k"), bound.start());
        assertNull(bound.lower());
        assertNull(bound.upper());
        assertTrue(bound.contains(b("a")));
    }

    @Test
    void emptyPrefixIsUnbounded() {
        assertSame(Bound.unbounded(), Bound.prefix(new byte[0]));
    }
}
