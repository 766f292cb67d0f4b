package com.ciro.jsxt.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class WhitespaceTest {

    @Test
    void asciiAndUnicodeSpacesCount() {
        for (int cp : new int[] {' ', '\t', '\n', '\r', 0x0B, 0x0C, 0x85, 0xA0, 0x1680, 0x2007, 0x2028, 0x202F, 0x3000}) {
            assertTrue(Whitespace.isWhitespace(cp), () -> "U+" + Integer.toHexString(cp));
        }
        assertFalse(Whitespace.isWhitespace('x'));
        assertFalse(Whitespace.isWhitespace(0x200B)); // zero width space no es Zs
    }

    @Test
    void trimsBothEndsOnly() {
        assertEquals("a b", Whitespace.trim("  a b  \u0085"));
        assertEquals("", Whitespace.trim(" 　"));
        assertEquals("", Whitespace.trim(""));
        assertEquals("x", Whitespace.trim("x"));
    }

    @Test
    void supplementaryCharactersAreKept() {
        assertEquals("😀", Whitespace.trim(" 😀 "));
    }
}
