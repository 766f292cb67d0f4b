package com.ciro.jsxt.ast;

import java.util.Objects;

/** Texto literal, sin normalizar espacios ni escapes. */
public record TextNode(String text) implements JsxNode {

    public TextNode {
        Objects.requireNonNull(text, "text");
    }
}
