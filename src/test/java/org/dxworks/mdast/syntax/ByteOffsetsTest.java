package org.dxworks.mdast.syntax;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ByteOffsetsTest {

    @Test
    void asciiOffsetsAreUnchanged() {
        ByteOffsets offsets = ByteOffsets.of("plain");
        assertEquals(0, offsets.toCharIndex(0));
        assertEquals(3, offsets.toCharIndex(3));
        assertEquals(5, offsets.toCharIndex(5));
    }

    @Test
    void multiByteCharactersCollapse() {
        // "é" is two bytes, "€" three, the emoji four bytes and two chars
        ByteOffsets offsets = ByteOffsets.of("é€😀x");

        assertEquals(1, offsets.toCharIndex(2));
        assertEquals(2, offsets.toCharIndex(5));
        assertEquals(4, offsets.toCharIndex(9));
        assertEquals(5, offsets.toCharIndex(10));
    }

    @Test
    void offsetsOutsideTheSourceAreClamped() {
        ByteOffsets offsets = ByteOffsets.of("abc");
        assertEquals(0, offsets.toCharIndex(-4));
        assertEquals(3, offsets.toCharIndex(99));
    }
}
