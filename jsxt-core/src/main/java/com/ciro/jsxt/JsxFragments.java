package com.ciro.jsxt;

import com.ciro.jsxt.ast.JsxNode;
import com.ciro.jsxt.ast.ParseError;
import com.ciro.jsxt.ast.Span;
import com.ciro.jsxt.ast.Utf8;
import com.ciro.jsxt.diagnostics.DiagnosticFormatter;
import com.ciro.jsxt.parser.JsxParser;
import com.ciro.jsxt.parser.NestingLimitException;
import com.ciro.jsxt.parser.ParseStep;
import com.ciro.jsxt.scanner.CandidateLocator;
import com.ciro.jsxt.scanner.FirstAngleLocator;
import java.util.Objects;
import java.util.Optional;

/**
 * Recorre los fragmentos JSX top-level de un fuente: pide candidatos al locator
 * y parsea desde cada uno.
 *
 * Tras un error de parseo se sigue con {@link FirstAngleLocator}: el recorrido
 * quedó dentro de JSX roto y ahí las reglas léxicas de JS no valen. Con el
 * siguiente fragmento parseado se abre de nuevo el locator configurado, desde
 * el final de ese fragmento.
 */
public final class JsxFragments {

    public sealed interface Step permits Fragment, Failure {}

    /** Fragmento parseado. {@code start} y {@code end} son índices de char del fuente. */
    public record Fragment(JsxNode node, int start, int end) implements Step {}

    /** Error de parseo; {@code position} en bytes UTF-8 desde el inicio del fuente. */
    public record Failure(int position, String message) implements Step {

        public String format(String source, String sourceName) {
            return DiagnosticFormatter.format(source, position, message, sourceName);
        }
    }

    private final String source;
    private final CandidateLocator locator;
    private CandidateLocator.Candidates candidates;
    private boolean recovering;

    public JsxFragments(String source, CandidateLocator locator) {
        this.source = Objects.requireNonNull(source, "source");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.candidates = locator.open(source, 0);
    }

    /**
     * Siguiente fragmento o error, o empty al final del fuente.
     *
     * @throws JsxException de tipo TRANSFORM si un fragmento anida más de
     *                      {@link JsxParser#MAX_DEPTH} elementos, o EXTRACTION si su span
     *                      no cae sobre el fuente
     */
    public Optional<Step> next() throws JsxException {
        int at = candidates.next();
        if (at < 0) return Optional.empty();

        Optional<ParseStep> step;
        try {
            step = new JsxParser(source, at).parseNextWithSpan();
        } catch (NestingLimitException e) {
            throw JsxException.unsupportedSyntax("JSX nested more than " + JsxParser.MAX_DEPTH
                    + " elements deep at byte " + (Utf8.toByteOffset(source, at) + e.position()));
        }
        if (step.isEmpty()) return Optional.empty();

        if (step.get() instanceof ParseStep.Parsed parsed) {
            Span span = parsed.span();
            int start;
            int end;
            try {
                start = Utf8.advance(source, at, span.start());
                end = Utf8.advance(source, start, span.length());
            } catch (IllegalArgumentException e) {
                throw JsxException.extraction("span " + span + " from index " + at + " is not on the source: " + e.getMessage());
            }
            if (recovering) {
                recovering = false;
                candidates = locator.open(source, end);
            } else {
                candidates.skipTo(end);
            }
            return Optional.of(new Fragment(parsed.node(), start, end));
        }

        ParseError error = ((ParseStep.Failed) step.get()).error();
        int resume = at + Character.charCount(source.codePointAt(at)); // siguiente code point
        if (recovering) {
            candidates.skipTo(resume);
        } else {
            recovering = true;
            candidates = FirstAngleLocator.INSTANCE.open(source, resume);
        }
        return Optional.of(new Failure(Utf8.toByteOffset(source, at) + error.position(), error.message()));
    }
}
