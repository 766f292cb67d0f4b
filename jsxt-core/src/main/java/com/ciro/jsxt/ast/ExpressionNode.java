package com.ciro.jsxt.ast;

import java.util.Objects;

/** Contenido crudo de un {@code {...}} hijo, sin las llaves externas. */
public record ExpressionNode(String expression) implements JsxNode {

    public ExpressionNode {
        Objects.requireNonNull(expression, "expression");
    }
}
