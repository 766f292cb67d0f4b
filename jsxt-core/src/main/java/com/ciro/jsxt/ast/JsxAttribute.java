package com.ciro.jsxt.ast;

import java.util.Objects;

/**
 * Atributo de un elemento.
 * <ul>
 *   <li>{@code value == null} y nombre normal: atributo booleano ({@code disabled}).</li>
 *   <li>Nombre que empieza con {@code ...}: spread, el resto del nombre es el objetivo.</li>
 * </ul>
 */
public record JsxAttribute(String name, AttributeValue value) {

    public static final String SPREAD_PREFIX = "...";

    public JsxAttribute {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) throw new IllegalArgumentException("empty attribute name");
    }

    public static JsxAttribute flag(String name) {
        return new JsxAttribute(name, null);
    }

    public static JsxAttribute spread(String target) {
        return new JsxAttribute(SPREAD_PREFIX + target, null);
    }

    public boolean isSpread() {
        return name.startsWith(SPREAD_PREFIX);
    }

    public boolean isBoolean() {
        return value == null && !isSpread();
    }

    /** Lo que va detrás del {@code ...}; vacío si no es un spread. */
    public String spreadTarget() {
        return isSpread() ? name.substring(SPREAD_PREFIX.length()) : "";
    }
}
