package com.ciro.jsxt.ast;

import java.util.Objects;

/** Error de parseo: offset en bytes (relativo al inicio del parser) y mensaje. */
public record ParseError(int position, String message) {

    public ParseError {
        if (position < 0) throw new IllegalArgumentException("negative position: " + position);
        Objects.requireNonNull(message, "message");
    }
}
