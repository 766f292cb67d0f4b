package com.ciro.jsxt.diagnostics;

import com.ciro.jsxt.ast.Utf8;
import java.util.Objects;

/**
 * Diagnóstico estilo compilador con línea, columna y caret:
 *
 * <pre>
 *   --> input:2:1
 *   |
 * 2 | &lt;span&gt;ok&lt;/div&gt;
 *   | ^
 *   |
 *   = note: Mismatched closing tag: expected span, found div
 * </pre>
 *
 * Los tabs se expanden a 4 espacios y las columnas cuentan code points (1-based).
 */
public final class DiagnosticFormatter {

    public static final String DEFAULT_SOURCE_NAME = "input";

    private static final String TAB = "    ";

    private DiagnosticFormatter() {}

    public static String format(String source, int bytePosition, String message) {
        return format(source, bytePosition, message, DEFAULT_SOURCE_NAME);
    }

    /**
     * @param bytePosition offset en bytes UTF-8; se recorta a la longitud del fuente y,
     *                     si cae dentro de un code point, se lleva al inicio de éste
     */
    public static String format(String source, int bytePosition, String message, String sourceName) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(sourceName, "sourceName");
        if (bytePosition < 0) throw new IllegalArgumentException("negative position: " + bytePosition);

        int pos = floorCharIndex(source, bytePosition);

        int lineStart = source.lastIndexOf('\n', pos - 1) + 1;
        int lineEnd = source.indexOf('\n', pos);
        if (lineEnd < 0) lineEnd = source.length();

        String prefix = source.substring(lineStart, pos).replace("\t", TAB);
        String line = source.substring(lineStart, lineEnd).replace("\t", TAB);

        int lineNo = 1;
        for (int i = 0; i < pos; i++) {
            if (source.charAt(i) == '\n') lineNo++;
        }
        int prefixWidth = prefix.codePointCount(0, prefix.length());
        int colNo = prefixWidth + 1;

        String number = Integer.toString(lineNo);
        String gutter = " ".repeat(number.length());

        StringBuilder out = new StringBuilder();
        out.append("  --> ").append(sourceName).append(':').append(lineNo).append(':').append(colNo).append('\n');
        out.append(gutter).append(" |\n");
        out.append(number).append(" | ").append(line).append('\n');
        out.append(gutter).append(" | ");
        if (pos != 0) {
            out.append(" ".repeat(prefixWidth)).append('^');
        } else {
            // posición 0: se marca toda la línea
            out.append("^".repeat(line.codePointCount(0, line.length())));
        }
        out.append('\n');
        out.append(gutter).append(" |\n");
        out.append(gutter).append(" = note: ").append(message).append('\n');
        return out.toString();
    }

    private static int floorCharIndex(String s, int byteOffset) {
        int bytes = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int next = bytes + Utf8.width(cp);
            if (next > byteOffset) break;
            bytes = next;
            i += Character.charCount(cp);
        }
        return i;
    }
}
