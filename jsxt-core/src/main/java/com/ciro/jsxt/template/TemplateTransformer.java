package com.ciro.jsxt.template;

import com.ciro.jsxt.JsxException;
import com.ciro.jsxt.ast.JsxAttribute;
import com.ciro.jsxt.ast.JsxVisitor;
import com.ciro.jsxt.ast.Whitespace;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Visitor que convierte un árbol JSX en el cuerpo de un template literal.
 *
 * Pila explícita de frames (elemento, componente, fragmento), cada uno con su
 * {@link TemplateBuilder}. Al cerrar un frame su salida se agrega al padre.
 * La raíz es un fragmento implícito, así que texto o expresiones sueltas también funcionan.
 */
public class TemplateTransformer implements JsxVisitor<JsxException> {

    private static final String OPENING_BRACKET = "<";

    private final HelperNames helpers;
    private final AttributeRenderer attributes;
    private final NestedCompiler nested;
    private final Deque<Frame> stack = new ArrayDeque<>();

    public TemplateTransformer(HelperNames helpers, NestedCompiler nested) {
        this.helpers = helpers;
        this.attributes = new AttributeRenderer(helpers);
        this.nested = nested;
        stack.push(new FragmentFrame(helpers));
    }

    @Override
    public void enterElement(String tag, List<JsxAttribute> attrs) throws JsxException {
        TagKind kind = TagKind.classify(tag);
        if (kind == TagKind.COMPONENT) {
            if (hasEmptySegment(tag)) throw JsxException.invalidComponent(tag);
            stack.push(new ComponentFrame(helpers, tag, attributes.component(attrs)));
        } else {
            if (hasEmptySegment(tag)) throw JsxException.invalidElement(tag);
            stack.push(new ElementFrame(helpers, tag, attributes.element(attrs), kind == TagKind.VOID));
        }
    }

    @Override
    public void exitElement(String tag) {
        Frame frame = stack.pop();
        String rendered;
        if (frame instanceof ComponentFrame c) {
            String children = c.builder.finish();
            rendered = children.isEmpty()
                    ? "${" + helpers.component() + "(" + c.tag + ", " + c.attributes + ")}"
                    : "${" + helpers.component() + "(" + c.tag + ", " + c.attributes + ", `" + children + "`)}";
        } else if (frame instanceof ElementFrame e) {
            // void: los hijos, si los hubo, se descartan
            rendered = e.isVoid
                    ? "<" + e.tag + e.attributes + "/>"
                    : "<" + e.tag + e.attributes + ">" + e.builder.finish() + "</" + e.tag + ">";
        } else {
            throw new IllegalStateException("exitElement(" + tag + ") without a matching enterElement");
        }
        current().appendChild(rendered);
    }

    @Override
    public void enterFragment() {
        stack.push(new FragmentFrame(helpers));
    }

    @Override
    public void exitFragment() {
        Frame frame = stack.pop();
        if (!(frame instanceof FragmentFrame) || stack.isEmpty()) {
            throw new IllegalStateException("exitFragment without a matching enterFragment");
        }
        current().appendChild(frame.builder.finish());
    }

    @Override
    public void visitText(String text) {
        current().pushText(text);
    }

    @Override
    public void visitExpression(String expression) throws JsxException {
        if (!expression.contains(OPENING_BRACKET)) {
            current().pushExpression(expression);
            return;
        }
        // JSX dentro de la expresión: pipeline completo recursivo
        String compiled = Whitespace.trim(nested.compile(expression));
        if (ListHeuristics.needsListWrapper(expression)) {
            current().appendChild("${" + helpers.list() + "(" + compiled + ")}");
        } else {
            current().appendChild("${" + compiled + "}");
        }
    }

    /** Cuerpo final del template (sin backticks). */
    public String finish() {
        if (stack.size() != 1) {
            throw new IllegalStateException("unbalanced traversal: " + (stack.size() - 1) + " open frame(s)");
        }
        return stack.peek().builder.finish();
    }

    private TemplateBuilder current() {
        return stack.peek().builder;
    }

    /** {@code Foo.}, {@code .Foo}, {@code Foo..Bar} */
    private static boolean hasEmptySegment(String tag) {
        return tag.startsWith(".") || tag.endsWith(".") || tag.contains("..");
    }

    // ==============================================================
    // Frames
    // ==============================================================

    private abstract static class Frame {
        final TemplateBuilder builder;

        Frame(HelperNames helpers) {
            this.builder = new TemplateBuilder(helpers);
        }
    }

    private static final class FragmentFrame extends Frame {
        FragmentFrame(HelperNames helpers) {
            super(helpers);
        }
    }

    private static final class ElementFrame extends Frame {
        final String tag;
        final String attributes;
        final boolean isVoid;

        ElementFrame(HelperNames helpers, String tag, String attributes, boolean isVoid) {
            super(helpers);
            this.tag = tag;
            this.attributes = attributes;
            this.isVoid = isVoid;
        }
    }

    private static final class ComponentFrame extends Frame {
        final String tag;
        final String attributes;

        ComponentFrame(HelperNames helpers, String tag, String attributes) {
            super(helpers);
            this.tag = tag;
            this.attributes = attributes;
        }
    }
}
