package com.ciro.jsxt.template;

import java.util.Locale;
import java.util.Set;

/** Clasificación de un nombre de tag. El orden de las reglas importa. */
public enum TagKind {
    COMPONENT,
    WEB_COMPONENT,
    VOID,
    ELEMENT;

    /** Tags que nunca tienen hijos y se cierran con {@code />}. Incluye formas SVG. */
    public static final Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "circle", "col", "ellipse", "embed", "hr", "image", "img",
            "input", "line", "link", "meta", "param", "path", "polygon", "polyline", "rect",
            "source", "track", "use", "wbr");

    public static TagKind classify(String tag) {
        if (tag.isEmpty()) return ELEMENT;
        int first = tag.codePointAt(0);
        if (Character.isUpperCase(first) || first == '_' || first == '$') return COMPONENT;
        if (tag.indexOf('-') >= 0) return WEB_COMPONENT;
        if (VOID_TAGS.contains(tag.toLowerCase(Locale.ROOT))) return VOID;
        return ELEMENT;
    }
}
