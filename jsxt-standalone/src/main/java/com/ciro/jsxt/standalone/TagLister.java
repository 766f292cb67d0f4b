package com.ciro.jsxt.standalone;

import com.ciro.jsxt.CommentStripper;
import com.ciro.jsxt.JsxException;
import com.ciro.jsxt.JsxFragments;
import com.ciro.jsxt.TransformOptions;
import com.ciro.jsxt.ast.JsxWalker;
import com.ciro.jsxt.template.TagCollector;
import com.ciro.jsxt.template.TagCollector.TagUse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lista los tags de cada fragmento JSX top-level de un fuente, sin generar
 * templates. El JSX que vive dentro de expresiones no se recorre. Los errores
 * de parseo se juntan igual que al transformar.
 */
final class TagLister {

    private final TransformOptions options;

    TagLister(TransformOptions options) {
        this.options = options;
    }

    List<TagUse> collect(String source) throws JsxException {
        String input = options.stripComments() ? CommentStripper.strip(source) : source;
        JsxFragments fragments = new JsxFragments(input, options.locator().locator());
        List<TagUse> tags = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        Optional<JsxFragments.Step> step;
        while ((step = fragments.next()).isPresent()) {
            if (step.get() instanceof JsxFragments.Fragment fragment) {
                TagCollector collector = new TagCollector();
                JsxWalker.walk(fragment.node(), collector);
                tags.addAll(collector.tags());
            } else if (step.get() instanceof JsxFragments.Failure failure) {
                errors.add(failure.format(input, options.sourceName()));
            }
        }

        if (!errors.isEmpty()) {
            throw JsxException.parsing(String.join("\n", errors));
        }
        return tags;
    }

    /** Una línea por tag, indentada según su profundidad. */
    static String render(List<TagUse> tags) {
        StringBuilder sb = new StringBuilder();
        for (TagUse use : tags) {
            sb.append("  ".repeat(use.depth() + 1))
              .append(use.tag()).append(' ').append(use.kind())
              .append('\n');
        }
        return sb.toString();
    }
}
