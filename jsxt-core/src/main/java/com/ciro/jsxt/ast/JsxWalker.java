package com.ciro.jsxt.ast;

import java.util.List;

/** Recorre el árbol en pre-orden llamando a los hooks del {@link JsxVisitor}. */
public final class JsxWalker {

    private JsxWalker() {}

    public static <X extends Exception> void walk(JsxNode node, JsxVisitor<X> visitor) throws X {
        if (node instanceof ElementNode el) {
            visitor.enterElement(el.tag(), el.attributes());
            walkAll(el.children(), visitor);
            visitor.exitElement(el.tag());
            return;
        }
        if (node instanceof FragmentNode f) {
            visitor.enterFragment();
            walkAll(f.children(), visitor);
            visitor.exitFragment();
            return;
        }
        if (node instanceof TextNode t) {
            visitor.visitText(t.text());
            return;
        }
        if (node instanceof ExpressionNode e) {
            visitor.visitExpression(e.expression());
            return;
        }
        throw new IllegalArgumentException("unknown node: " + node);
    }

    public static <X extends Exception> void walkAll(List<JsxNode> nodes, JsxVisitor<X> visitor) throws X {
        for (JsxNode n : nodes) walk(n, visitor);
    }
}
