package com.ciro.jsxt.ast;

/**
 * Conversión entre offsets en bytes UTF-8 (los que expone la API) e índices
 * de {@code char} UTF-16 (los que usa {@link String}).
 */
public final class Utf8 {

    private Utf8() {}

    /** Bytes UTF-8 que ocupa un code point. Un surrogate suelto cuenta como 3. */
    public static int width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    public static int byteLength(CharSequence s) {
        return byteLength(s, 0, s.length());
    }

    public static int byteLength(CharSequence s, int from, int to) {
        int bytes = 0;
        int i = from;
        while (i < to) {
            int cp = Character.codePointAt(s, i);
            bytes += width(cp);
            i += Character.charCount(cp);
        }
        return bytes;
    }

    /** Offset en bytes del índice {@code charIndex}. */
    public static int toByteOffset(String s, int charIndex) {
        if (charIndex < 0 || charIndex > s.length()) {
            throw new IllegalArgumentException("char index out of range: " + charIndex);
        }
        return byteLength(s, 0, charIndex);
    }

    /** Índice de char que corresponde al offset en bytes {@code byteOffset}. */
    public static int toCharIndex(String s, int byteOffset) {
        return advance(s, 0, byteOffset);
    }

    /**
     * Avanza {@code byteCount} bytes desde {@code fromIndex} y devuelve el índice
     * de char resultante. El destino tiene que caer en un límite de code point.
     */
    public static int advance(String s, int fromIndex, int byteCount) {
        if (byteCount < 0) {
            throw new IllegalArgumentException("negative byte offset: " + byteCount);
        }
        int bytes = 0;
        int i = fromIndex;
        while (i < s.length() && bytes < byteCount) {
            int cp = s.codePointAt(i);
            bytes += width(cp);
            i += Character.charCount(cp);
        }
        if (bytes != byteCount) {
            throw new IllegalArgumentException("byte offset " + byteCount
                    + " is out of range or not on a code point boundary");
        }
        return i;
    }
}
