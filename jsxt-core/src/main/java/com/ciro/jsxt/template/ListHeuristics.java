package com.ciro.jsxt.template;

import com.ciro.jsxt.ast.Whitespace;
import java.util.Set;

/**
 * Heurística sintáctica: ¿la expresión produce (probablemente) un array?
 * Busca {@code .name(} o {@code ?.name(} fuera de strings y templates, con
 * {@code name} en la lista de métodos que devuelven arrays.
 */
public final class ListHeuristics {

    static final Set<String> ARRAY_METHODS = Set.of(
            "map", "flatMap", "filter",
            "slice", "concat", "flat",
            "toReversed", "toSorted", "toSpliced", "with",
            "reverse", "sort", "splice", "fill", "copyWithin",
            // no devuelven arrays pero se envuelven igual
            "reduce", "reduceRight", "forEach");

    private ListHeuristics() {}

    public static boolean needsListWrapper(String expression) {
        boolean inSingle = false;
        boolean inDouble = false;
        boolean inTemplate = false;
        boolean escape = false;

        int len = expression.length();
        int i = 0;
        while (i < len) {
            char c = expression.charAt(i++);
            if (escape) {
                escape = false;
                continue;
            }
            if (c == '\\') {
                escape = true;
                continue;
            }
            if (c == '\'' && !inDouble && !inTemplate) {
                inSingle = !inSingle;
                continue;
            }
            if (c == '"' && !inSingle && !inTemplate) {
                inDouble = !inDouble;
                continue;
            }
            if (c == '`' && !inSingle && !inDouble) {
                inTemplate = !inTemplate;
                continue;
            }
            if (inSingle || inDouble || inTemplate) continue;

            boolean atProperty = false;
            if (c == '.') {
                atProperty = true;
            } else if (c == '?' && i < len && expression.charAt(i) == '.') {
                i++;
                atProperty = true;
            }
            if (!atProperty) continue;

            int nameStart = i;
            if (i < len && isNameStart(expression.charAt(i))) {
                i++;
                while (i < len && (isNameStart(expression.charAt(i)) || isDigit(expression.charAt(i)))) i++;
            }
            String name = expression.substring(nameStart, i);

            if (isCallAt(expression, i) && ARRAY_METHODS.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /** Mira (sin consumir) si tras espacios viene {@code (} o {@code ?.(}. */
    private static boolean isCallAt(String s, int from) {
        int j = from;
        while (j < s.length()) {
            int cp = s.codePointAt(j);
            if (!Whitespace.isWhitespace(cp)) break;
            j += Character.charCount(cp);
        }
        if (j >= s.length()) return false;
        if (s.charAt(j) == '(') return true;
        return s.startsWith("?.(", j);
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
