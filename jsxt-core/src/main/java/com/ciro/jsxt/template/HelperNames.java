package com.ciro.jsxt.template;

import java.util.Objects;

/** Identificadores de los helpers de runtime que aparecen en la salida. */
public record HelperNames(String component, String list, String spread) {

    public static final HelperNames DEFAULT = new HelperNames("__jsxComponent", "__jsxList", "__jsxSpread");

    public HelperNames {
        requireName(component, "component");
        requireName(list, "list");
        requireName(spread, "spread");
    }

    private static void requireName(String value, String what) {
        Objects.requireNonNull(value, what);
        if (value.isBlank()) throw new IllegalArgumentException("blank " + what + " helper name");
    }
}
