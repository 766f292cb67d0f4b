package com.ciro.jsxt.parser;

import com.ciro.jsxt.ast.Utf8;

/**
 * Cursor rebobinable sobre el fuente. Avanza por code points y lleva a la vez
 * el índice de char y la posición en bytes UTF-8 (relativa al origen).
 */
final class Cursor {

    static final int EOF = -1;

    record Mark(int index, int position) {}

    private final String src;
    private int index;
    private int position;

    Cursor(String src, int fromIndex) {
        this.src = src;
        this.index = fromIndex;
        this.position = 0;
    }

    int peek() {
        return index < src.length() ? src.codePointAt(index) : EOF;
    }

    /** Code point {@code n} posiciones más adelante (0 = actual). */
    int peek(int n) {
        int i = index;
        for (int k = 0; k < n; k++) {
            if (i >= src.length()) return EOF;
            i += Character.charCount(src.codePointAt(i));
        }
        return i < src.length() ? src.codePointAt(i) : EOF;
    }

    boolean startsWith(String prefix) {
        return src.startsWith(prefix, index);
    }

    void bump() {
        if (index >= src.length()) return;
        int cp = src.codePointAt(index);
        index += Character.charCount(cp);
        position += Utf8.width(cp);
    }

    boolean atEnd() {
        return index >= src.length();
    }

    /** Posición en bytes desde el origen del cursor. */
    int position() {
        return position;
    }

    Mark mark() {
        return new Mark(index, position);
    }

    void reset(Mark mark) {
        this.index = mark.index();
        this.position = mark.position();
    }
}
