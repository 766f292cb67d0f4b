package com.ciro.jsxt.parser;

import com.ciro.jsxt.ast.ParseError;

/** Error de {@link JsxParser#parseNext()}. */
public class ParseException extends Exception {

    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error.message() + " at byte " + error.position());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
