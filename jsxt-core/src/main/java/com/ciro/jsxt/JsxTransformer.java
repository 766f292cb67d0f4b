package com.ciro.jsxt;

import com.ciro.jsxt.ast.JsxNode;
import com.ciro.jsxt.ast.JsxWalker;
import com.ciro.jsxt.diagnostics.DiagnosticFormatter;
import com.ciro.jsxt.scanner.CandidateLocator;
import com.ciro.jsxt.template.TemplateTransformer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Punto de entrada: reemplaza cada fragmento JSX de un fuente JS/TS por un
 * template literal. El texto que no es JSX se copia tal cual.
 *
 * Los errores de parseo no cortan el recorrido: se acumulan (formateados con
 * {@link DiagnosticFormatter}) y al final se lanzan juntos en un único
 * {@link JsxException} de tipo PARSING. Un error de transformación sí corta.
 *
 * El recorrido de fragmentos y la recuperación tras errores están en
 * {@link JsxFragments}.
 *
 * Las instancias son inmutables y se pueden compartir entre threads.
 */
public class JsxTransformer {

    private static final Logger log = LoggerFactory.getLogger(JsxTransformer.class);

    /** Límite de recursión de expresiones con JSX anidado dentro de JSX. */
    static final int MAX_NESTING = 200;

    private static final String EMPTY_INTERPOLATION = "${}";

    private final TransformOptions options;
    private final CandidateLocator locator;

    public JsxTransformer() {
        this(TransformOptions.defaults());
    }

    public JsxTransformer(TransformOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.locator = options.locator().locator();
    }

    public String transform(String source) throws JsxException {
        Objects.requireNonNull(source, "source");
        return transform(source, 0);
    }

    private String transform(String source, int depth) throws JsxException {
        if (depth > MAX_NESTING) {
            throw JsxException.unsupportedSyntax("JSX nested more than " + MAX_NESTING + " expressions deep");
        }

        String input = options.stripComments() ? CommentStripper.strip(source) : source;
        StringBuilder out = new StringBuilder(input.length() + 32);
        List<String> errors = new ArrayList<>();
        JsxFragments fragments = new JsxFragments(input, locator);
        int cursor = 0;
        int count = 0;

        Optional<JsxFragments.Step> step;
        while ((step = fragments.next()).isPresent()) {
            if (step.get() instanceof JsxFragments.Fragment fragment) {
                String template = render(fragment.node(), depth);
                if (fragment.start() > cursor) out.append(input, cursor, fragment.start());
                out.append('`').append(template).append('`');
                cursor = fragment.end();
                count++;
            } else if (step.get() instanceof JsxFragments.Failure failure) {
                if (log.isDebugEnabled()) {
                    log.debug("parse error at byte {}: {}", failure.position(), failure.message());
                }
                errors.add(failure.format(input, options.sourceName()));
            }
        }

        if (cursor < input.length()) out.append(input, cursor, input.length());

        if (!errors.isEmpty()) {
            throw JsxException.parsing(String.join("\n", errors));
        }

        log.debug("transformed {} JSX fragment(s) at depth {}", count, depth);
        return out.toString().replace(EMPTY_INTERPOLATION, "");
    }

    private String render(JsxNode node, int depth) throws JsxException {
        TemplateTransformer transformer = new TemplateTransformer(options.helpers(), expression -> {
            log.debug("nested JSX expression at depth {}", depth + 1);
            return transform(expression, depth + 1);
        });
        JsxWalker.walk(node, transformer);
        return transformer.finish();
    }
}
