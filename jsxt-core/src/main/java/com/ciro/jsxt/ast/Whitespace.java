package com.ciro.jsxt.ast;

/**
 * Espacio en blanco Unicode, el mismo para saltar blancos al parsear y para
 * recortar templates. Incluye los espacios de no separación ({@code U+00A0},
 * {@code U+2007}, {@code U+202F}) y {@code U+0085}, que {@link String#strip()} no cuenta.
 */
public final class Whitespace {

    private static final int NEXT_LINE = 0x85;

    private Whitespace() {}

    public static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == NEXT_LINE;
    }

    /** Quita los blancos de ambos extremos. */
    public static String trim(String s) {
        int start = 0;
        int end = s.length();
        while (start < end) {
            int cp = s.codePointAt(start);
            if (!isWhitespace(cp)) break;
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = s.codePointBefore(end);
            if (!isWhitespace(cp)) break;
            end -= Character.charCount(cp);
        }
        return s.substring(start, end);
    }
}
