package com.ciro.jsxt.parser;

/**
 * Elementos o fragmentos anidados más allá de {@link JsxParser#MAX_DEPTH}.
 * No es un error de sintaxis recuperable: corta el parseo entero.
 */
public class NestingLimitException extends RuntimeException {

    private final int position;

    public NestingLimitException(int position) {
        super("JSX nested more than " + JsxParser.MAX_DEPTH + " elements deep at byte " + position);
        this.position = position;
    }

    /** Offset en bytes del {@code <} que superó el límite, relativo al inicio del parser. */
    public int position() {
        return position;
    }
}
