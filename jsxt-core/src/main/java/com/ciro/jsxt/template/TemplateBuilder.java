package com.ciro.jsxt.template;

import com.ciro.jsxt.ast.Whitespace;

/** Acumula el contenido de un frame: texto, interpolaciones y templates hijos. */
public final class TemplateBuilder {

    private static final String OPEN = "${";

    private final StringBuilder out = new StringBuilder();
    private final HelperNames helpers;

    public TemplateBuilder(HelperNames helpers) {
        this.helpers = helpers;
    }

    public void pushText(String text) {
        out.append(text);
    }

    /** Interpolación de una expresión sin JSX. */
    public void pushExpression(String expression) {
        String inner = singleInterpolation(expression);
        if (inner != null) {
            out.append(OPEN).append(inner).append('}');
        } else if (ListHeuristics.needsListWrapper(expression)) {
            out.append(OPEN).append(helpers.list()).append('(').append(expression).append(")}");
        } else {
            out.append(OPEN).append(expression).append('}');
        }
    }

    /** Template ya renderado de un hijo; {@code ${`${x}`}} se aplana a {@code ${x}}. */
    public void appendChild(String template) {
        String flat = flattenTrivialChild(template);
        out.append(flat != null ? flat : template);
    }

    /** Contenido final, recortado. */
    public String finish() {
        return Whitespace.trim(out.toString());
    }

    /** Si la expresión es {@code `${inner}`} (una sola interpolación y nada más) devuelve {@code inner}. */
    static String singleInterpolation(String expression) {
        String s = Whitespace.trim(expression);
        if (s.length() < 2 || !s.startsWith("`") || !s.endsWith("`")) return null;
        return innerOfLoneInterpolation(Whitespace.trim(s.substring(1, s.length() - 1)));
    }

    static String flattenTrivialChild(String template) {
        String t = Whitespace.trim(template);
        if (t.length() < 5 || !t.startsWith("${`") || !t.endsWith("`}")) return null;
        String inner = innerOfLoneInterpolation(Whitespace.trim(t.substring(3, t.length() - 2)));
        return inner == null ? null : OPEN + inner + "}";
    }

    private static String innerOfLoneInterpolation(String s) {
        if (s.length() < 3 || !s.startsWith(OPEN) || !s.endsWith("}")) return null;
        if (s.indexOf(OPEN, OPEN.length()) >= 0) return null;
        return s.substring(2, s.length() - 1);
    }
}
