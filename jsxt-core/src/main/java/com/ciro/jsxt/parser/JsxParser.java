package com.ciro.jsxt.parser;

import com.ciro.jsxt.ast.AttributeValue;
import com.ciro.jsxt.ast.ElementNode;
import com.ciro.jsxt.ast.ExpressionNode;
import com.ciro.jsxt.ast.FragmentNode;
import com.ciro.jsxt.ast.JsxAttribute;
import com.ciro.jsxt.ast.JsxNode;
import com.ciro.jsxt.ast.ParseError;
import com.ciro.jsxt.ast.ParseResult;
import com.ciro.jsxt.ast.Span;
import com.ciro.jsxt.ast.TextNode;
import com.ciro.jsxt.ast.Whitespace;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parser JSX de descenso recursivo.
 *
 * Todas las posiciones (spans y errores) son offsets en bytes UTF-8 relativos
 * al punto de arranque del parser. Un fallo en cualquier nivel de anidamiento
 * se reporta en el inicio de la construcción top-level que lo contiene.
 *
 * La profundidad de elementos está acotada por {@link #MAX_DEPTH}; pasarla
 * lanza {@link NestingLimitException} en vez de un error de parseo.
 */
public class JsxParser {

    /** Máximo de elementos/fragmentos abiertos a la vez. */
    public static final int MAX_DEPTH = 256;

    static final String EXPECTED_GT = "Expected >";
    static final String EXPECTED_GT_AFTER_SLASH = "Expected > after /";
    static final String EXPECTED_GT_FRAGMENT_CLOSE = "Expected > for fragment closing tag";
    static final String EXPECTED_IDENTIFIER = "Expected identifier";
    static final String UNTERMINATED_STRING = "Unterminated string literal";
    static final String EXPECTED_STRING_OR_EXPRESSION = "Expected string or expression";
    static final String UNCLOSED_EXPRESSION = "Unclosed expression";

    private static final String SCRIPT = "script";
    private static final String FRAGMENT_LABEL = "fragment";

    private final Cursor cursor;
    private int depth;

    public JsxParser(String source) {
        this(source, 0);
    }

    /** Parser que arranca en el índice de char {@code fromIndex} de {@code source}. */
    public JsxParser(String source, int fromIndex) {
        Objects.requireNonNull(source, "source");
        if (fromIndex < 0 || fromIndex > source.length()) {
            throw new IllegalArgumentException("start index out of range: " + fromIndex);
        }
        this.cursor = new Cursor(source, fromIndex);
    }

    /** Offset en bytes actual. */
    public int position() {
        return cursor.position();
    }

    /**
     * Parsea todas las construcciones hasta el final. Tras un error avanza un
     * code point desde donde quedó el cursor y sigue buscando.
     */
    public ParseResult parse() {
        List<JsxNode> nodes = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        Optional<ParseStep> step;
        while ((step = parseNextWithSpan()).isPresent()) {
            if (step.get() instanceof ParseStep.Parsed parsed) {
                nodes.add(parsed.node());
            } else if (step.get() instanceof ParseStep.Failed failed) {
                errors.add(failed.error());
                cursor.bump();
            }
        }
        return new ParseResult(nodes, errors);
    }

    /** Siguiente construcción, o empty si se acabó el input. */
    public Optional<JsxNode> parseNext() throws ParseException {
        Optional<ParseStep> step = parseNextWithSpan();
        if (step.isEmpty()) return Optional.empty();
        if (step.get() instanceof ParseStep.Failed failed) {
            throw new ParseException(failed.error());
        }
        return Optional.of(((ParseStep.Parsed) step.get()).node());
    }

    /**
     * Salta hasta el próximo {@code <} y parsea un elemento o fragmento desde ahí.
     * Si el {@code <} no inicia JSX se devuelve un error en su posición sin consumirlo.
     *
     * @throws NestingLimitException si el fragmento anida más de {@link #MAX_DEPTH} elementos
     */
    public Optional<ParseStep> parseNextWithSpan() {
        while (!cursor.atEnd()) {
            if (cursor.peek() != '<') {
                cursor.bump();
                continue;
            }
            int start = cursor.position();
            int next = cursor.peek(1);
            if (next == '>') {
                return Optional.of(attempt(start, true));
            }
            if (IdentifierRule.isStart(next)) {
                return Optional.of(attempt(start, false));
            }
            return Optional.of(new ParseStep.Failed(new ParseError(start, EXPECTED_IDENTIFIER)));
        }
        return Optional.empty();
    }

    private ParseStep attempt(int start, boolean fragment) {
        try {
            depth = 0;
            JsxNode node = fragment ? parseFragment() : parseElement();
            return new ParseStep.Parsed(node, new Span(start, cursor.position()));
        } catch (Failure f) {
            return new ParseStep.Failed(new ParseError(start, f.getMessage()));
        }
    }

    // ==============================================================
    // Construcciones
    // ==============================================================

    private ElementNode parseElement() {
        enter();
        cursor.bump(); // <
        skipWhitespace();
        String tag = parseIdentifier(IdentifierRule.TAG_NAME);
        skipWhitespace();
        List<JsxAttribute> attributes = parseAttributes();
        skipWhitespace();

        if (cursor.peek() == '/') {
            cursor.bump();
            if (cursor.peek() != '>') throw new Failure(EXPECTED_GT_AFTER_SLASH);
            cursor.bump();
            depth--;
            return new ElementNode(tag, attributes, List.of());
        }

        if (cursor.peek() != '>') throw new Failure(EXPECTED_GT);
        cursor.bump();

        List<JsxNode> children = parseChildren(tag);
        depth--;
        return new ElementNode(tag, attributes, children);
    }

    private FragmentNode parseFragment() {
        enter();
        cursor.bump(); // <
        cursor.bump(); // >
        List<JsxNode> children = parseChildren(null);
        depth--;
        return new FragmentNode(children);
    }

    private void enter() {
        if (++depth > MAX_DEPTH) throw new NestingLimitException(cursor.position());
    }

    /** {@code parentTag == null} significa fragmento. */
    private List<JsxNode> parseChildren(String parentTag) {
        if (SCRIPT.equals(parentTag)) {
            return List.of(parseScriptBody());
        }

        List<JsxNode> children = new ArrayList<>();
        while (true) {
            int c = cursor.peek();
            if (c == Cursor.EOF) {
                throw new Failure("Unclosed tag: " + (parentTag == null ? FRAGMENT_LABEL : parentTag));
            }

            if (c == '<') {
                int next = cursor.peek(1);
                if (next == '/') {
                    closeTag(parentTag);
                    return children;
                }
                children.add(next == '>' ? parseFragment() : parseElement());
            } else if (c == '{') {
                children.add(parseExpression());
            } else {
                children.add(parseText());
            }
        }
    }

    private void closeTag(String parentTag) {
        cursor.bump(); // <
        cursor.bump(); // /
        skipWhitespace();

        if (parentTag == null) {
            if (cursor.peek() != '>') throw new Failure(EXPECTED_GT_FRAGMENT_CLOSE);
            cursor.bump();
            return;
        }

        String closing = parseIdentifier(IdentifierRule.TAG_NAME);
        if (!closing.equals(parentTag)) {
            throw new Failure("Mismatched closing tag: expected " + parentTag + ", found " + closing);
        }
        skipWhitespace();
        if (cursor.peek() != '>') throw new Failure(EXPECTED_GT);
        cursor.bump();
    }

    /**
     * Cuerpo de {@code <script>}: texto crudo hasta el primer {@code </script>}
     * (con espacios opcionales). Sin cierre se devuelve lo leído hasta el final.
     */
    private TextNode parseScriptBody() {
        StringBuilder raw = new StringBuilder();
        int c;
        while ((c = cursor.peek()) != Cursor.EOF) {
            if (c == '<' && cursor.peek(1) == '/') {
                Cursor.Mark mark = cursor.mark();
                cursor.bump();
                cursor.bump();
                skipWhitespace();
                if (SCRIPT.equals(readIdentifier(IdentifierRule.TAG_NAME))) {
                    skipWhitespace();
                    if (cursor.peek() == '>') {
                        cursor.bump();
                        break;
                    }
                }
                cursor.reset(mark);
            }
            raw.appendCodePoint(c);
            cursor.bump();
        }
        return new TextNode(raw.toString());
    }

    private List<JsxAttribute> parseAttributes() {
        List<JsxAttribute> attributes = new ArrayList<>();
        int c;
        while ((c = cursor.peek()) != Cursor.EOF && c != '>' && c != '/') {
            skipWhitespace();

            if (cursor.startsWith(JsxAttribute.SPREAD_PREFIX)) {
                cursor.bump();
                cursor.bump();
                cursor.bump();
                String target = IdentifierRule.isStart(cursor.peek())
                        ? parseIdentifier(IdentifierRule.TAG_NAME)
                        : parseExpressionContent();
                attributes.add(JsxAttribute.spread(target));
                skipWhitespace();
                continue;
            }

            String name = readIdentifier(IdentifierRule.ATTRIBUTE_NAME);
            if (name == null) {
                // carácter que no abre un nombre (ej: las llaves de {...props}): se salta
                cursor.bump();
                name = "";
            }
            skipWhitespace();

            AttributeValue value = null;
            if (cursor.peek() == '=') {
                cursor.bump();
                skipWhitespace();
                value = parseAttributeValue();
            }

            if (!name.isEmpty()) {
                attributes.add(new JsxAttribute(name, value));
            }
            skipWhitespace();
        }
        return attributes;
    }

    private AttributeValue parseAttributeValue() {
        int c = cursor.peek();
        if (c == '"') return new AttributeValue.DoubleQuoted(parseQuoted('"'));
        if (c == '\'') return new AttributeValue.SingleQuoted(parseQuoted('\''));
        if (c == '{') {
            cursor.bump();
            return new AttributeValue.Expression(parseExpressionContent());
        }
        throw new Failure(EXPECTED_STRING_OR_EXPRESSION);
    }

    /** Sin escapes: el string termina en la primera comilla igual. */
    private String parseQuoted(int quote) {
        cursor.bump();
        StringBuilder value = new StringBuilder();
        int c;
        while ((c = cursor.peek()) != Cursor.EOF) {
            cursor.bump();
            if (c == quote) return value.toString();
            value.appendCodePoint(c);
        }
        throw new Failure(UNTERMINATED_STRING);
    }

    private ExpressionNode parseExpression() {
        cursor.bump(); // {
        return new ExpressionNode(parseExpressionContent());
    }

    /**
     * Lee tras un {@code {} ya consumido hasta su {@code }} pareja, que se consume
     * pero no se incluye. Cuenta llaves sin mirar strings ni comentarios.
     */
    private String parseExpressionContent() {
        StringBuilder content = new StringBuilder();
        int depth = 1;
        int c;
        while ((c = cursor.peek()) != Cursor.EOF) {
            cursor.bump();
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return content.toString();
            }
            content.appendCodePoint(c);
        }
        throw new Failure(UNCLOSED_EXPRESSION);
    }

    private TextNode parseText() {
        StringBuilder text = new StringBuilder();
        int c;
        while ((c = cursor.peek()) != Cursor.EOF && c != '<' && c != '{') {
            text.appendCodePoint(c);
            cursor.bump();
        }
        return new TextNode(text.toString());
    }

    // ==============================================================
    // Léxico
    // ==============================================================

    private String parseIdentifier(IdentifierRule rule) {
        String id = readIdentifier(rule);
        if (id == null) throw new Failure(EXPECTED_IDENTIFIER);
        return id;
    }

    /** Identificador en la posición actual, o null (sin consumir nada) si no empieza uno. */
    private String readIdentifier(IdentifierRule rule) {
        if (!IdentifierRule.isStart(cursor.peek())) return null;
        StringBuilder id = new StringBuilder();
        id.appendCodePoint(cursor.peek());
        cursor.bump();
        int c;
        while (rule.isPart(c = cursor.peek())) {
            id.appendCodePoint(c);
            cursor.bump();
        }
        return id.toString();
    }

    private void skipWhitespace() {
        while (isWhitespace(cursor.peek())) cursor.bump();
    }

    static boolean isWhitespace(int cp) {
        return cp != Cursor.EOF && Whitespace.isWhitespace(cp);
    }

    /** Fallo interno; se convierte en {@link ParseError} al nivel top-level. */
    private static final class Failure extends RuntimeException {
        Failure(String message) {
            super(message, null, false, false);
        }
    }
}
