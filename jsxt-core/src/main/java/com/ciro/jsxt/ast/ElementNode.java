package com.ciro.jsxt.ast;

import java.util.List;
import java.util.Objects;

/**
 * Elemento {@code <tag attrs>children</tag>}. Los componentes también son
 * ElementNode: la clasificación la hace el transformador según el nombre.
 */
public record ElementNode(String tag, List<JsxAttribute> attributes, List<JsxNode> children) implements JsxNode {

    public ElementNode {
        Objects.requireNonNull(tag, "tag");
        if (tag.isEmpty()) throw new IllegalArgumentException("empty tag name");
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }
}
