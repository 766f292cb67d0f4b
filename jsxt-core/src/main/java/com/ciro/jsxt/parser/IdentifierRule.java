package com.ciro.jsxt.parser;

/**
 * Reglas de identificador. El primer carácter siempre es letra ASCII, {@code _} o {@code $};
 * los siguientes admiten letras y dígitos Unicode, {@code _}, {@code $} y {@code -}.
 */
public enum IdentifierRule {

    /** Nombres de tag, tags de cierre y objetivos de spread: admite {@code .} ({@code <Foo.Bar>}). */
    TAG_NAME(true),

    /** Nombres de atributo: sin {@code .}. */
    ATTRIBUTE_NAME(false);

    private final boolean allowsDots;

    IdentifierRule(boolean allowsDots) {
        this.allowsDots = allowsDots;
    }

    public static boolean isStart(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '_' || cp == '$';
    }

    public boolean isPart(int cp) {
        if (cp == Cursor.EOF) return false;
        return Character.isLetterOrDigit(cp) || cp == '_' || cp == '$' || cp == '-'
                || (allowsDots && cp == '.');
    }
}
