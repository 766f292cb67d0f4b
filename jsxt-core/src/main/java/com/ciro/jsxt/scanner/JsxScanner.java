package com.ciro.jsxt.scanner;

import com.ciro.jsxt.ast.Utf8;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Scanner O(N) que encuentra el próximo {@code <} que puede abrir JSX, saltando
 * comentarios, strings, regex y los tramos crudos de template literals.
 *
 * No filtra {@code <} usados como operadores ({@code a <b}): sólo garantiza que
 * el candidato no está dentro de una región que no es código. Dentro de una
 * interpolación {@code ${...}} de un template el código vuelve a ser código, y
 * ahí también hay candidatos.
 *
 * Una instancia es un recorrido con estado: tras {@link #skipTo} sigue en el
 * mismo modo y con la misma pila de templates.
 */
public final class JsxScanner implements CandidateLocator.Candidates {

    /** Locator basado en este scanner. */
    public static final CandidateLocator LOCATOR = JsxScanner::new;

    private static final int CONTINUE = -1;
    private static final int EXHAUSTED = -2;

    private static final Set<String> BEFORE_OPERAND_KEYWORDS = Set.of(
            "return", "throw", "case", "else", "yield", "await", "typeof", "void",
            "delete", "new", "in", "instanceof", "of", "do", "default", "as",
            "import", "export");

    private enum Mode {
        NORMAL,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        REGEX,
        // mientras haya frames en templates
        TEMPLATE
    }

    /** Estado de un nivel de template literal. */
    private static final class TemplateFrame {
        boolean inExpression;
        int braceDepth;
        boolean escape;
    }

    private final String src;
    private final int len;
    private int i;

    private Mode mode = Mode.NORMAL;
    private char quote;
    private TokenContext ctx = TokenContext.BEFORE_OPERAND; // inicio de archivo: se admite regex
    private final Deque<TemplateFrame> templates = new ArrayDeque<>();

    private JsxScanner(String src, int from) {
        this.src = src;
        this.len = src.length();
        this.i = Math.min(Math.max(from, 0), len);
    }

    /**
     * Offset en bytes UTF-8 del próximo candidato a partir de {@code fromByte}.
     *
     * @throws IllegalArgumentException si {@code fromByte} no es un límite de code point del fuente
     */
    public static OptionalInt findNextStart(String source, int fromByte) {
        int from = fromByte >= Utf8.byteLength(source) ? source.length() : Utf8.toCharIndex(source, fromByte);
        int found = new JsxScanner(source, from).next();
        return found < 0 ? OptionalInt.empty() : OptionalInt.of(Utf8.toByteOffset(source, found));
    }

    @Override
    public void skipTo(int index) {
        i = Math.min(Math.max(index, i), len);
        ctx = TokenContext.AFTER_OPERAND;
    }

    @Override
    public int next() {
        while (i < len) {
            switch (mode) {
                case NORMAL -> {
                    int found = stepNormal();
                    if (found >= 0) return found;
                }
                case LINE_COMMENT -> {
                    skipLineComment();
                    mode = Mode.NORMAL;
                    ctx = TokenContext.BEFORE_OPERAND;
                }
                case BLOCK_COMMENT -> {
                    if (!skipBlockComment()) return -1;
                    mode = Mode.NORMAL;
                    ctx = TokenContext.BEFORE_OPERAND;
                }
                case STRING -> {
                    skipString(quote);
                    mode = Mode.NORMAL;
                    ctx = TokenContext.AFTER_OPERAND;
                }
                case REGEX -> {
                    skipRegex();
                    mode = Mode.NORMAL;
                    ctx = TokenContext.AFTER_OPERAND;
                }
                case TEMPLATE -> {
                    int found = stepTemplate();
                    if (found >= 0) return found;
                    if (found == EXHAUSTED) return -1;
                }
            }
        }
        return -1;
    }

    /** Un paso en modo normal. Devuelve el índice del candidato o -1 si hay que seguir. */
    private int stepNormal() {
        char c = src.charAt(i);
        if (startsWith("//")) {
            i += 2;
            mode = Mode.LINE_COMMENT;
            return -1;
        }
        if (startsWith("/*")) {
            i += 2;
            mode = Mode.BLOCK_COMMENT;
            return -1;
        }
        if (c == '\'' || c == '"') {
            i++;
            quote = c;
            mode = Mode.STRING;
            return -1;
        }
        if (c == '`') {
            i++;
            templates.push(new TemplateFrame());
            mode = Mode.TEMPLATE;
            ctx = TokenContext.BEFORE_OPERAND;
            return -1;
        }
        if (c == '/' && ctx == TokenContext.BEFORE_OPERAND) {
            i++;
            mode = Mode.REGEX;
            return -1;
        }
        if (c == '<' && i + 1 < len && opensTag(src.charAt(i + 1))) {
            return i;
        }
        bumpAndUpdateContext();
        return -1;
    }

    private static boolean opensTag(char n) {
        return isAsciiLetter(n) || n == '_' || n == '$' || n == '/' || n == '>' || n == '!' || n == '?';
    }

    /**
     * Un paso dentro de un template. Devuelve el índice de un candidato dentro de
     * {@code ${...}}, {@link #CONTINUE}, o {@link #EXHAUSTED} si el input se acabó
     * dentro del template.
     */
    private int stepTemplate() {
        TemplateFrame frame = templates.peek();
        if (frame == null) {
            mode = Mode.NORMAL;
            return CONTINUE;
        }

        if (!frame.inExpression) {
            if (i >= len) return EXHAUSTED;
            char c = src.charAt(i++);
            if (frame.escape) {
                frame.escape = false;
            } else if (c == '\\') {
                frame.escape = true;
            } else if (c == '`') {
                templates.pop();
                if (templates.isEmpty()) {
                    mode = Mode.NORMAL;
                    ctx = TokenContext.AFTER_OPERAND;
                }
            } else if (c == '$' && i < len && src.charAt(i) == '{') {
                i++;
                frame.inExpression = true;
                frame.braceDepth = 0;
                ctx = TokenContext.BEFORE_OPERAND;
            }
            return CONTINUE;
        }

        // dentro de ${ ... }
        if (startsWith("//")) {
            i += 2;
            skipLineComment();
            ctx = TokenContext.BEFORE_OPERAND;
            return CONTINUE;
        }
        if (startsWith("/*")) {
            i += 2;
            if (!skipBlockComment()) return EXHAUSTED;
            ctx = TokenContext.BEFORE_OPERAND;
            return CONTINUE;
        }
        if (i >= len) return EXHAUSTED;

        char c = src.charAt(i);
        if (c == '<' && i + 1 < len && opensTag(src.charAt(i + 1))) {
            return i;
        }
        if (c == '\'' || c == '"') {
            i++;
            skipString(c);
            ctx = TokenContext.AFTER_OPERAND;
        } else if (c == '`') {
            i++;
            templates.push(new TemplateFrame());
            ctx = TokenContext.BEFORE_OPERAND;
        } else if (c == '/' && ctx == TokenContext.BEFORE_OPERAND) {
            i++;
            skipRegex();
            ctx = TokenContext.AFTER_OPERAND;
        } else if (c == '{') {
            i++;
            frame.braceDepth++;
            ctx = TokenContext.BEFORE_OPERAND;
        } else if (c == '}') {
            i++;
            if (frame.braceDepth == 0) {
                frame.inExpression = false;
                ctx = TokenContext.AFTER_OPERAND;
            } else {
                frame.braceDepth--;
            }
        } else {
            bumpAndUpdateContext();
        }
        return CONTINUE;
    }

    // ==============================================================
    // Saltos
    // ==============================================================

    private void skipLineComment() {
        while (i < len) {
            char c = src.charAt(i++);
            if (c == '\n') break;
            if (c == '\r') {
                if (i < len && src.charAt(i) == '\n') i++;
                break;
            }
        }
    }

    private boolean skipBlockComment() {
        int end = src.indexOf("*/", i);
        if (end < 0) {
            i = len;
            return false;
        }
        i = end + 2;
        return true;
    }

    private void skipString(char q) {
        boolean escape = false;
        while (i < len) {
            char c = src.charAt(i++);
            if (escape) {
                escape = false;
            } else if (c == '\\') {
                escape = true;
            } else if (c == q) {
                break;
            }
        }
    }

    /** El {@code /} inicial ya se consumió. Consume cuerpo, clases {@code [...]} y flags. */
    private void skipRegex() {
        boolean inClass = false;
        boolean escape = false;
        while (i < len) {
            char c = src.charAt(i++);
            if (escape) {
                escape = false;
            } else if (c == '\\') {
                escape = true;
            } else if (c == '[' && !inClass) {
                inClass = true;
            } else if (c == ']' && inClass) {
                inClass = false;
            } else if (c == '/' && !inClass) {
                while (i < len && isAsciiLetter(src.charAt(i))) i++;
                break;
            }
        }
    }

    private void bumpAndUpdateContext() {
        char c = src.charAt(i);

        if (isSpace(c)) {
            while (i < len && isSpace(src.charAt(i))) i++;
            return;
        }

        if (isIdentStart(c)) {
            int start = i++;
            while (i < len && (isIdentStart(src.charAt(i)) || isDigit(src.charAt(i)))) i++;
            String word = src.substring(start, i).toLowerCase(Locale.ROOT);
            ctx = BEFORE_OPERAND_KEYWORDS.contains(word) ? TokenContext.BEFORE_OPERAND : TokenContext.AFTER_OPERAND;
            return;
        }

        if (isDigit(c)) {
            i++;
            while (i < len && isDigit(src.charAt(i))) i++;
            if (i < len && src.charAt(i) == '.') {
                i++;
                while (i < len && isDigit(src.charAt(i))) i++;
            }
            ctx = TokenContext.AFTER_OPERAND;
            return;
        }

        i++;
        ctx = (c == ')' || c == ']' || c == '}' || c == '.')
                ? TokenContext.AFTER_OPERAND
                : TokenContext.BEFORE_OPERAND;
    }

    private boolean startsWith(String pattern) {
        return src.startsWith(pattern, i);
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == 0x0B || c == 0x0C;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return isAsciiLetter(c) || c == '_' || c == '$';
    }
}
