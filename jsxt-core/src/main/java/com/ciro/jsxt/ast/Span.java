package com.ciro.jsxt.ast;

/** Rango semiabierto {@code [start, end)} en bytes UTF-8. */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
